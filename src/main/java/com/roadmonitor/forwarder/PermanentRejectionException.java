package com.roadmonitor.forwarder;

/**
 * Сервис хранения отклонил пакет как некорректный. Повторная отправка того же пакета
 * не поможет; решение о судьбе буфера остаётся за вызывающим кодом.
 */
public class PermanentRejectionException extends DeliveryException {

  private final int statusCode;
  private final String responseBody;

  public PermanentRejectionException(int statusCode, String responseBody) {
    super("Сервис хранения отклонил пакет: HTTP " + statusCode + " " + responseBody);
    this.statusCode = statusCode;
    this.responseBody = responseBody;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public String getResponseBody() {
    return responseBody;
  }
}
