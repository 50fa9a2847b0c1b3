package com.roadmonitor.forwarder;

/**
 * Временная ошибка доставки: сеть, таймаут, 5xx. Пакет можно отправить повторно.
 */
public class TransientDeliveryException extends DeliveryException {

  public TransientDeliveryException(String message) {
    super(message);
  }

  public TransientDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
