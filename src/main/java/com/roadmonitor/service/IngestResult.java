package com.roadmonitor.service;

import com.roadmonitor.model.StoredRecord;

import java.util.List;

/**
 * Результат успешного приёма пакета: сохранённые записи в порядке пакета.
 */
public final class IngestResult {

  private final List<StoredRecord> stored;

  public IngestResult(List<StoredRecord> stored) {
    this.stored = List.copyOf(stored);
  }

  public List<StoredRecord> getStored() {
    return stored;
  }

  public List<Long> getIds() {
    return stored.stream().map(StoredRecord::getId).toList();
  }

  public int size() {
    return stored.size();
  }
}
