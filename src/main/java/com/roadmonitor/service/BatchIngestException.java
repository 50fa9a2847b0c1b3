package com.roadmonitor.service;

import com.roadmonitor.db.StorageException;
import com.roadmonitor.model.StoredRecord;

import java.util.List;

/**
 * Приём пакета прерван на записи {@code failedIndex}.
 * <p>
 * Записи до неё уже сохранены и разосланы подписчикам; они не откатываются и перечислены
 * в {@link #getCommitted()}. Причина: {@link ValidationException} или {@link StorageException}.
 */
public class BatchIngestException extends RuntimeException {

  private final int failedIndex;
  private final List<StoredRecord> committed;

  public BatchIngestException(int failedIndex, List<StoredRecord> committed, RuntimeException cause) {
    super("Запись #" + failedIndex + " пакета не принята: " + cause.getMessage(), cause);
    this.failedIndex = failedIndex;
    this.committed = List.copyOf(committed);
  }

  /**
   * Индекс записи в пакете (с нуля).
   */
  public int getFailedIndex() {
    return failedIndex;
  }

  public List<StoredRecord> getCommitted() {
    return committed;
  }

  public boolean isValidationFailure() {
    return getCause() instanceof ValidationException;
  }
}
