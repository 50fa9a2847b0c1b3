package com.roadmonitor.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.roadmonitor.db.RecordStore;
import com.roadmonitor.db.StorageException;
import com.roadmonitor.model.ProcessedRecord;
import com.roadmonitor.model.StoredRecord;
import com.roadmonitor.subscription.SubscriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Реализация сервиса приёма записей.
 */
public class IngestionServiceImpl implements IngestionService {

  private static final Logger logger = LoggerFactory.getLogger(IngestionServiceImpl.class);

  private final RecordStore recordStore;
  private final SubscriptionRegistry subscriptionRegistry;

  /**
   * Конструктор сервиса.
   *
   * @param recordStore          Хранилище записей.
   * @param subscriptionRegistry Реестр подписчиков для рассылки новых записей.
   */
  public IngestionServiceImpl(RecordStore recordStore, SubscriptionRegistry subscriptionRegistry) {
    this.recordStore = Objects.requireNonNull(recordStore, "recordStore");
    this.subscriptionRegistry = Objects.requireNonNull(subscriptionRegistry, "subscriptionRegistry");
  }

  @Override
  public IngestResult ingest(List<JsonNode> batch) {
    if (batch == null) {
      throw new IllegalArgumentException("Batch cannot be null");
    }

    List<StoredRecord> committed = new ArrayList<>(batch.size());
    for (int i = 0; i < batch.size(); i++) {
      // 1. Проверяем
      ProcessedRecord record;
      try {
        record = RecordParser.parse(batch.get(i));
      } catch (ValidationException e) {
        logger.warn("❌ Запись #{} пакета не прошла проверку: {}. Сохранено до неё: {}",
            i, e.getMessage(), committed.size());
        throw new BatchIngestException(i, committed, e);
      }

      // 2. Сохраняем в БД
      StoredRecord stored;
      try {
        stored = recordStore.insert(record);
      } catch (StorageException e) {
        logger.error("❌ Не удалось сохранить запись #{} пакета. Сохранено до неё: {}", i, committed.size(), e);
        throw new BatchIngestException(i, committed, e);
      }
      committed.add(stored);

      // 3. Рассылаем подписчикам только после успешного сохранения
      subscriptionRegistry.notify(record.getAgentData().getUserId(), record);
    }

    logger.info("✅ Пакет из {} записей сохранён", committed.size());
    return new IngestResult(committed);
  }

  @Override
  public StoredRecord read(long id) {
    return recordStore.findById(id).orElseThrow(() -> new RecordNotFoundException(id));
  }

  @Override
  public List<StoredRecord> list() {
    return recordStore.findAll();
  }

  @Override
  public StoredRecord update(long id, JsonNode body) {
    ProcessedRecord record = RecordParser.parse(body);
    StoredRecord updated = recordStore.update(id, record).orElseThrow(() -> new RecordNotFoundException(id));
    logger.info("Запись {} обновлена", id);
    return updated;
  }

  @Override
  public StoredRecord delete(long id) {
    StoredRecord deleted = recordStore.delete(id).orElseThrow(() -> new RecordNotFoundException(id));
    logger.info("Запись {} удалена", id);
    return deleted;
  }
}
