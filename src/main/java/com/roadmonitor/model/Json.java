package com.roadmonitor.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Общий {@link ObjectMapper}: даты пишутся строками ISO-8601, а не числами.
 */
public final class Json {

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  private Json() {
  }

  public static ObjectMapper mapper() {
    return MAPPER;
  }

  /**
   * Сериализует объект в JSON.
   *
   * @throws IllegalStateException если объект не сериализуется (ошибка программирования).
   */
  public static String toJson(Object value) {
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Не удалось сериализовать " + value.getClass().getSimpleName(), e);
    }
  }
}
