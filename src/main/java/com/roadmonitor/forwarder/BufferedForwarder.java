package com.roadmonitor.forwarder;

import com.roadmonitor.model.ProcessedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Буфер записей на стороне агента с пакетной отправкой в сервис хранения.
 * <p>
 * Когда в буфере набирается {@code batchSize} записей, выполняется автоматическая отправка
 * всего буфера одним пакетом. Записи удаляются из буфера только после подтверждения
 * доставки; при ошибке буфер остаётся прежним, а следующая автоматическая попытка
 * откладывается с экспоненциально растущей паузой.
 * <p>
 * Одновременно выполняется не больше одной отправки. Записи, добавленные во время
 * отправки, уйдут следующим пакетом.
 * <p>
 * После отказа сервиса автоматическая отправка приостанавливается до {@link #discardPending()}
 * или явного {@link #flush()}.
 */
public class BufferedForwarder implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(BufferedForwarder.class);

  private final BatchSender sender;
  private final int batchSize;
  private final int maxBufferSize;
  private final long initialBackoffMs;
  private final long maxBackoffMs;
  private final Clock clock;

  private final Object bufferLock = new Object();
  private final List<ProcessedRecord> buffer = new ArrayList<>();
  // Сколько записей за всё время ушло из головы буфера (доставлено, вытеснено или сброшено)
  private long headSequence;
  private boolean closed;

  private final ReentrantLock flushLock = new ReentrantLock();
  private long currentBackoffMs;
  private volatile long nextAttemptAtMs;
  private volatile boolean rejected;

  private final AtomicLong droppedCount = new AtomicLong();
  private final AtomicLong deliveredCount = new AtomicLong();

  /**
   * Буфер без ограничения размера.
   *
   * @param sender    Транспорт до сервиса хранения.
   * @param batchSize Порог автоматической отправки.
   */
  public BufferedForwarder(BatchSender sender, int batchSize) {
    this(sender, batchSize, 0, 500, 30_000, Clock.systemUTC());
  }

  /**
   * @param sender           Транспорт до сервиса хранения.
   * @param batchSize        Порог автоматической отправки, больше 0.
   * @param maxBufferSize    Максимальный размер буфера; 0 означает без ограничения. При переполнении
   *                         вытесняется самая старая запись (с предупреждением в логе).
   * @param initialBackoffMs Пауза перед повторной автоматической отправкой после первой ошибки.
   * @param maxBackoffMs     Верхняя граница паузы.
   * @param clock            Часы для расчёта пауз.
   */
  public BufferedForwarder(BatchSender sender, int batchSize, int maxBufferSize,
                           long initialBackoffMs, long maxBackoffMs, Clock clock) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize должен быть больше 0: " + batchSize);
    }
    if (maxBufferSize < 0 || (maxBufferSize > 0 && maxBufferSize < batchSize)) {
      throw new IllegalArgumentException("maxBufferSize должен быть 0 или не меньше batchSize: " + maxBufferSize);
    }
    this.sender = Objects.requireNonNull(sender, "sender");
    this.batchSize = batchSize;
    this.maxBufferSize = maxBufferSize;
    this.initialBackoffMs = initialBackoffMs;
    this.maxBackoffMs = Math.max(initialBackoffMs, maxBackoffMs);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Добавляет запись в буфер и при достижении порога запускает отправку.
   * <p>
   * Автоматическая отправка пропускается, если уже идёт другая отправка, ещё не истекла
   * пауза после ошибки или предыдущий пакет отклонён сервисом. Временная ошибка не выходит за пределы метода: записи остаются в буфере.
   *
   * @return true, если запись принята; false, если буфер уже закрыт.
   * @throws PermanentRejectionException если автоматическая отправка отклонена сервисом.
   *                                     Запись при этом уже находится в буфере.
   */
  public boolean enqueue(ProcessedRecord record) throws PermanentRejectionException {
    Objects.requireNonNull(record, "record");
    boolean thresholdReached;
    synchronized (bufferLock) {
      if (closed) {
        logger.warn("Буфер закрыт, запись отброшена: {}", record);
        return false;
      }
      buffer.add(record);
      if (maxBufferSize > 0 && buffer.size() > maxBufferSize) {
        ProcessedRecord evicted = buffer.remove(0);
        headSequence++;
        long total = droppedCount.incrementAndGet();
        logger.warn("Буфер переполнен ({} записей), вытеснена самая старая запись {}. Всего потеряно: {}",
            maxBufferSize, evicted, total);
      }
      thresholdReached = buffer.size() >= batchSize;
    }

    if (thresholdReached && !rejected && clock.millis() >= nextAttemptAtMs && flushLock.tryLock()) {
      try {
        doFlush();
      } finally {
        flushLock.unlock();
      }
    }
    return true;
  }

  /**
   * Отправляет весь текущий буфер одним пакетом. Ждёт завершения идущей отправки, если она есть.
   *
   * @return true, если пакет доставлен (или буфер пуст); false при временной ошибке,
   *         содержимое буфера в этом случае не меняется.
   * @throws PermanentRejectionException если сервис отклонил пакет; буфер не меняется.
   */
  public boolean flush() throws PermanentRejectionException {
    synchronized (bufferLock) {
      if (closed) {
        logger.warn("flush() после close(): {} записей не будут отправлены", buffer.size());
        return false;
      }
    }
    flushLock.lock();
    try {
      rejected = false;
      return doFlush();
    } finally {
      flushLock.unlock();
    }
  }

  private boolean doFlush() throws PermanentRejectionException {
    List<ProcessedRecord> batch;
    long batchStart;
    synchronized (bufferLock) {
      if (buffer.isEmpty()) {
        return true;
      }
      batch = new ArrayList<>(buffer);
      batchStart = headSequence;
    }

    try {
      sender.send(batch);
    } catch (TransientDeliveryException e) {
      long delay = scheduleRetry();
      logger.warn("Не удалось отправить пакет из {} записей: {}. Записи остаются в буфере, "
          + "следующая автоматическая попытка через {} мс", batch.size(), e.getMessage(), delay);
      return false;
    } catch (PermanentRejectionException e) {
      rejected = true;
      logger.error("Сервис хранения отклонил пакет из {} записей (HTTP {}). Буфер не изменён, "
          + "автоматическая отправка приостановлена", batch.size(), e.getStatusCode());
      throw e;
    }

    synchronized (bufferLock) {
      // Часть пакета могла быть вытеснена во время отправки
      long deliveredEnd = batchStart + batch.size();
      int toRemove = (int) Math.max(0, Math.min(buffer.size(), deliveredEnd - headSequence));
      buffer.subList(0, toRemove).clear();
      headSequence += toRemove;
    }
    currentBackoffMs = 0;
    nextAttemptAtMs = 0;
    deliveredCount.addAndGet(batch.size());
    logger.info("✅ Пакет из {} записей доставлен", batch.size());
    return true;
  }

  private long scheduleRetry() {
    currentBackoffMs = currentBackoffMs == 0 ? initialBackoffMs : Math.min(currentBackoffMs * 2, maxBackoffMs);
    nextAttemptAtMs = clock.millis() + currentBackoffMs;
    return currentBackoffMs;
  }

  /**
   * Удаляет из буфера все неотправленные записи (например, после отказа сервиса).
   *
   * @return Удалённые записи в исходном порядке.
   */
  public List<ProcessedRecord> discardPending() {
    synchronized (bufferLock) {
      List<ProcessedRecord> discarded = new ArrayList<>(buffer);
      buffer.clear();
      headSequence += discarded.size();
      rejected = false;
      if (!discarded.isEmpty()) {
        logger.warn("Сброшено {} неотправленных записей", discarded.size());
      }
      return discarded;
    }
  }

  /**
   * Последняя попытка отправки и освобождение транспорта.
   * <p>
   * Транспорт закрывается в любом случае. Недоставленные записи остаются доступны через
   * {@link #pendingRecords()}.
   *
   * @throws PermanentRejectionException если финальный пакет отклонён сервисом.
   */
  @Override
  public void close() throws PermanentRejectionException {
    synchronized (bufferLock) {
      if (closed) {
        return;
      }
      closed = true;
    }
    flushLock.lock();
    try {
      if (!doFlush()) {
        logger.error("❌ Буфер закрыт, {} записей не доставлены", pendingCount());
      }
    } finally {
      flushLock.unlock();
      sender.close();
    }
  }

  public int pendingCount() {
    synchronized (bufferLock) {
      return buffer.size();
    }
  }

  public List<ProcessedRecord> pendingRecords() {
    synchronized (bufferLock) {
      return List.copyOf(buffer);
    }
  }

  public long droppedCount() {
    return droppedCount.get();
  }

  public long deliveredCount() {
    return deliveredCount.get();
  }

  public int getBatchSize() {
    return batchSize;
  }
}
