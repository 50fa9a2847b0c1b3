package com.roadmonitor.subscription;

import java.util.concurrent.CompletableFuture;

/**
 * Канал подписчика, в который доставляются новые записи.
 * <p>
 * Реализации должны корректно работать в {@link java.util.Set}: два объекта над одним и тем же
 * соединением равны.
 */
public interface SubscriberChannel {

  boolean isOpen();

  /**
   * Асинхронно отправляет сообщение.
   *
   * @return Future, завершающийся ошибкой, если отправка не удалась.
   */
  CompletableFuture<Void> send(String message);
}
