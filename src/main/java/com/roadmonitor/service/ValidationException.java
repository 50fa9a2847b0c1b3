package com.roadmonitor.service;

/**
 * Запись не прошла проверку: отсутствует обязательное поле, неверный тип или формат.
 */
public class ValidationException extends RuntimeException {

  private final String field;

  public ValidationException(String field, String message) {
    super(field + ": " + message);
    this.field = field;
  }

  public ValidationException(String field, String message, Throwable cause) {
    super(field + ": " + message, cause);
    this.field = field;
  }

  /**
   * Путь к полю, например "agent_data.timestamp".
   */
  public String getField() {
    return field;
  }
}
