package com.roadmonitor.db;

import com.roadmonitor.model.ProcessedRecord;
import com.roadmonitor.model.StoredRecord;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Хранилище в памяти для тестов. Умеет имитировать отказ на N-й вставке.
 */
public class InMemoryRecordStore implements RecordStore {

  private final Map<Long, StoredRecord> records = new TreeMap<>();
  private long nextId = 1;
  private int insertCalls;
  private int failOnInsertCall = -1;

  /**
   * Вставка с номером {@code call} (с единицы) завершится {@link StorageException}.
   */
  public synchronized void failOnInsert(int call) {
    this.failOnInsertCall = call;
  }

  @Override
  public synchronized StoredRecord insert(ProcessedRecord record) {
    insertCalls++;
    if (insertCalls == failOnInsertCall) {
      throw new StorageException("Хранилище недоступно", new SQLException("connection refused"));
    }
    StoredRecord stored = new StoredRecord(nextId++, record);
    records.put(stored.getId(), stored);
    return stored;
  }

  @Override
  public synchronized Optional<StoredRecord> findById(long id) {
    return Optional.ofNullable(records.get(id));
  }

  @Override
  public synchronized List<StoredRecord> findAll() {
    return new ArrayList<>(records.values());
  }

  @Override
  public synchronized Optional<StoredRecord> update(long id, ProcessedRecord record) {
    if (!records.containsKey(id)) {
      return Optional.empty();
    }
    StoredRecord updated = new StoredRecord(id, record);
    records.put(id, updated);
    return Optional.of(updated);
  }

  @Override
  public synchronized Optional<StoredRecord> delete(long id) {
    return Optional.ofNullable(records.remove(id));
  }

  public synchronized int size() {
    return records.size();
  }
}
