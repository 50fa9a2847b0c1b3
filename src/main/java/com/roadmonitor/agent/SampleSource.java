package com.roadmonitor.agent;

import com.roadmonitor.model.AgentRecord;

import java.io.IOException;

/**
 * Перезапускаемый источник замеров агента.
 * <p>
 * Последовательность бесконечна: по достижении конца данных источник начинает сначала.
 */
public interface SampleSource extends AutoCloseable {

  /**
   * Открывает ресурсы источника. Вызывается один раз перед первым {@link #next()}.
   */
  void open() throws IOException;

  /**
   * Следующий замер. Конец данных не является ошибкой: чтение продолжается с начала.
   *
   * @throws IllegalStateException если источник не открыт или данные повреждены.
   */
  AgentRecord next();

  @Override
  void close() throws IOException;
}
