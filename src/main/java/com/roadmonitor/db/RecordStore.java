package com.roadmonitor.db;

import com.roadmonitor.model.ProcessedRecord;
import com.roadmonitor.model.StoredRecord;

import java.util.List;
import java.util.Optional;

/**
 * Хранилище обработанных записей. Идентификатор назначается хранилищем при вставке.
 * <p>
 * Все методы бросают {@link StorageException}, если хранилище недоступно.
 */
public interface RecordStore {

  /**
   * Сохраняет запись и фиксирует её.
   *
   * @return Сохранённая запись с назначенным идентификатором.
   */
  StoredRecord insert(ProcessedRecord record);

  Optional<StoredRecord> findById(long id);

  List<StoredRecord> findAll();

  /**
   * @return Запись после обновления или пустой Optional, если идентификатора нет.
   */
  Optional<StoredRecord> update(long id, ProcessedRecord record);

  /**
   * @return Запись до удаления или пустой Optional, если идентификатора нет.
   */
  Optional<StoredRecord> delete(long id);
}
