package com.roadmonitor.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Состояние дорожного покрытия, вычисляемое классификатором.
 */
public enum RoadState {
  NORMAL("normal"),
  SMALL_PITS("small_pits"),
  LARGE_PITS("large_pits");

  private final String value;

  RoadState(String value) {
    this.value = value;
  }

  /**
   * Значение, передаваемое по сети и хранимое в БД.
   */
  @JsonValue
  public String value() {
    return value;
  }

  /**
   * Разбирает строковое значение. Допускается написание через пробел ("small pits").
   *
   * @throws IllegalArgumentException если значение неизвестно.
   */
  public static RoadState fromValue(String text) {
    if (text != null) {
      String normalized = text.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
      for (RoadState state : values()) {
        if (state.value.equals(normalized)) {
          return state;
        }
      }
    }
    throw new IllegalArgumentException("Неизвестное состояние дороги: " + text);
  }
}
