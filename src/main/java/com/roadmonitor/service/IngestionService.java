package com.roadmonitor.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.roadmonitor.model.StoredRecord;

import java.util.List;

/**
 * Сервис приёма обработанных записей от агентов.
 * <p>
 * Сохраняет записи в хранилище и сразу рассылает их подписчикам соответствующего user_id.
 */
public interface IngestionService {

  /**
   * Принимает пакет: по порядку проверяет, сохраняет и рассылает каждую запись.
   * <p>
   * Каждая запись фиксируется отдельно. При ошибке на k-й записи обработка прекращается,
   * записи до неё остаются сохранёнными.
   *
   * @param batch Элементы JSON-массива.
   * @return Сохранённые записи с идентификаторами.
   * @throws BatchIngestException если запись не прошла проверку или хранилище недоступно.
   */
  IngestResult ingest(List<JsonNode> batch);

  /**
   * @throws RecordNotFoundException если записи нет.
   */
  StoredRecord read(long id);

  List<StoredRecord> list();

  /**
   * @return Запись после обновления.
   * @throws ValidationException     если тело некорректно.
   * @throws RecordNotFoundException если записи нет.
   */
  StoredRecord update(long id, JsonNode body);

  /**
   * @return Запись до удаления.
   * @throws RecordNotFoundException если записи нет.
   */
  StoredRecord delete(long id);
}
