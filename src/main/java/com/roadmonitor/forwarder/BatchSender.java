package com.roadmonitor.forwarder;

import com.roadmonitor.model.ProcessedRecord;

import java.util.List;

/**
 * Транспорт, доставляющий пакет записей в сервис хранения за один обмен.
 */
public interface BatchSender extends AutoCloseable {

  /**
   * Отправляет пакет и возвращает управление только после подтверждения приёма.
   *
   * @param batch Непустой пакет записей, порядок сохраняется.
   * @throws TransientDeliveryException   если доставка не подтверждена, но её можно повторить.
   * @throws PermanentRejectionException  если сервис отклонил пакет.
   */
  void send(List<ProcessedRecord> batch) throws TransientDeliveryException, PermanentRejectionException;

  @Override
  default void close() {
  }
}
