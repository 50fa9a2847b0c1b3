package com.roadmonitor.forwarder;

/**
 * Ошибка доставки пакета в сервис хранения.
 */
public abstract class DeliveryException extends Exception {

  protected DeliveryException(String message) {
    super(message);
  }

  protected DeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
