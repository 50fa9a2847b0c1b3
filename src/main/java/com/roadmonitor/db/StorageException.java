package com.roadmonitor.db;

/**
 * Хранилище недоступно или операция с ним завершилась ошибкой.
 */
public class StorageException extends RuntimeException {

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
