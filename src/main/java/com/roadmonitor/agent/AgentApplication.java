package com.roadmonitor.agent;

import com.roadmonitor.classifier.RoadStateClassifier;
import com.roadmonitor.config.Config;
import com.roadmonitor.forwarder.BufferedForwarder;
import com.roadmonitor.forwarder.HttpBatchSender;
import com.roadmonitor.forwarder.PermanentRejectionException;
import com.roadmonitor.model.AgentRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Агент: читает замеры, классифицирует их и пакетами отправляет в сервис хранения.
 */
public class AgentApplication {

  private static final Logger logger = LoggerFactory.getLogger(AgentApplication.class);

  private final SampleSource source;
  private final BufferedForwarder forwarder;

  public AgentApplication(SampleSource source, BufferedForwarder forwarder) {
    this.source = source;
    this.forwarder = forwarder;
  }

  /**
   * Один шаг конвейера: замер → классификация → буфер.
   *
   * @return false, если буфер уже закрыт.
   * @throws PermanentRejectionException если сервис отклонил пакет.
   */
  public boolean step() throws PermanentRejectionException {
    AgentRecord record = source.next();
    return forwarder.enqueue(RoadStateClassifier.process(record));
  }

  /**
   * Запускает шаги с фиксированной задержкой. При отказе сервиса неприемлемый пакет
   * сбрасывается, чтобы не блокировать последующие данные.
   */
  public ScheduledExecutorService start(long delayMs) throws IOException {
    source.open();
    ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "agent-producer");
      t.setDaemon(false);
      return t;
    });
    scheduler.scheduleWithFixedDelay(() -> {
      try {
        step();
      } catch (PermanentRejectionException e) {
        logger.error("❌ Пакет отклонён сервисом хранения: {}", e.getMessage());
        forwarder.discardPending();
      } catch (RuntimeException e) {
        // Исключение из задачи остановило бы расписание
        logger.error("❌ Ошибка шага агента", e);
      }
    }, 0, delayMs, TimeUnit.MILLISECONDS);
    return scheduler;
  }

  /**
   * Останавливает чтение и выполняет финальную отправку буфера.
   */
  public void stop(ScheduledExecutorService scheduler) throws InterruptedException {
    scheduler.shutdown();
    if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
      scheduler.shutdownNow();
    }
    try {
      forwarder.close();
    } catch (PermanentRejectionException e) {
      logger.error("❌ Финальный пакет отклонён сервисом хранения: {}", e.getMessage());
    } finally {
      try {
        source.close();
      } catch (IOException e) {
        logger.warn("Не удалось закрыть источник данных", e);
      }
    }
  }

  /**
   * Точка входа агента. Параметры берутся из application.properties.
   */
  public static void main(String[] args) throws Exception {
    SampleSource source = new CsvSampleSource(
        Path.of(Config.getRequiredProperty("agent.accelerometer.file")),
        Path.of(Config.getRequiredProperty("agent.gps.file")),
        Config.getIntProperty("agent.user.id", 1)
    );
    Duration timeout = Duration.ofMillis(Config.getLongProperty("forwarder.timeout.ms", 5000));
    BufferedForwarder forwarder = new BufferedForwarder(
        new HttpBatchSender(Config.getRequiredProperty("store.api.url"), timeout),
        Config.getIntProperty("forwarder.batch.size", 10),
        Config.getIntProperty("forwarder.max.buffer.size", 0),
        Config.getLongProperty("forwarder.backoff.initial.ms", 500),
        Config.getLongProperty("forwarder.backoff.max.ms", 30_000),
        Clock.systemUTC()
    );

    AgentApplication agent = new AgentApplication(source, forwarder);
    ScheduledExecutorService scheduler = agent.start(Config.getLongProperty("agent.delay.ms", 100));
    logger.info("🚀 Агент запущен, отправка в {}", Config.getRequiredProperty("store.api.url"));

    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      try {
        agent.stop(scheduler);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }, "agent-shutdown"));
  }
}
