package com.roadmonitor.subscription;

import com.roadmonitor.model.Json;
import com.roadmonitor.model.ProcessedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Живые каналы подписчиков, сгруппированные по идентификатору источника (user_id).
 * <p>
 * Рассылка идёт по снимку набора каналов, поэтому отключение подписчика во время рассылки
 * безопасно. Рассылки для одного источника выполняются по очереди, в порядке вызовов
 * {@link #notify(int, ProcessedRecord)}. Канал, отправка в который не удалась, удаляется.
 */
public class SubscriptionRegistry {

  private static final Logger logger = LoggerFactory.getLogger(SubscriptionRegistry.class);

  private final Map<Integer, Set<SubscriberChannel>> subscriptions = new ConcurrentHashMap<>();

  /**
   * Регистрирует канал. Повторная регистрация того же канала ничего не меняет.
   */
  public void subscribe(int producerId, SubscriberChannel channel) {
    subscriptions.compute(producerId, (id, channels) -> {
      Set<SubscriberChannel> set = channels != null ? channels : new CopyOnWriteArraySet<>();
      if (set.add(channel)) {
        logger.info("🔔 Новый подписчик для user_id={} (всего {})", producerId, set.size());
      }
      return set;
    });
  }

  /**
   * Удаляет канал. Удаление отсутствующего канала не считается ошибкой.
   */
  public void unsubscribe(int producerId, SubscriberChannel channel) {
    subscriptions.computeIfPresent(producerId, (id, channels) -> {
      if (channels.remove(channel)) {
        logger.info("Подписчик user_id={} отключён (осталось {})", producerId, channels.size());
      }
      return channels.isEmpty() ? null : channels;
    });
  }

  /**
   * Рассылает запись всем каналам, подписанным на {@code producerId} в момент вызова.
   *
   * @return Количество каналов, которым была начата отправка.
   */
  public int notify(int producerId, ProcessedRecord record) {
    Set<SubscriberChannel> channels = subscriptions.get(producerId);
    if (channels == null) {
      return 0;
    }
    String payload = Json.toJson(record);
    int sent = 0;
    synchronized (channels) {
      for (SubscriberChannel channel : channels) {
        if (!channel.isOpen()) {
          unsubscribe(producerId, channel);
          continue;
        }
        try {
          channel.send(payload).whenComplete((ignored, error) -> {
            if (error != null) {
              logger.warn("Не удалось отправить запись подписчику user_id={}: {}", producerId, error.getMessage());
              unsubscribe(producerId, channel);
            }
          });
          sent++;
        } catch (RuntimeException e) {
          logger.warn("Ошибка отправки подписчику user_id={}, канал удалён", producerId, e);
          unsubscribe(producerId, channel);
        }
      }
    }
    return sent;
  }

  public int subscriberCount(int producerId) {
    Set<SubscriberChannel> channels = subscriptions.get(producerId);
    return channels == null ? 0 : channels.size();
  }
}
