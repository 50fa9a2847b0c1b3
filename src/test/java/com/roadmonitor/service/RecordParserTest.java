package com.roadmonitor.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.roadmonitor.model.Json;
import com.roadmonitor.model.ProcessedRecord;
import com.roadmonitor.model.RoadState;
import com.roadmonitor.model.TestRecords;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordParserTest {

  @Test
  @DisplayName("Корректная запись разбирается полностью")
  void shouldParseValidRecord() {
    ProcessedRecord record = RecordParser.parse(TestRecords.json(1, 15000));

    assertThat(record).isEqualTo(TestRecords.processed(1, 15000));
    assertThat(record.getRoadState()).isEqualTo(RoadState.NORMAL);
  }

  @Test
  @DisplayName("Смещение часового пояса сохраняется")
  void shouldKeepOffset() {
    ProcessedRecord record = RecordParser.parse(TestRecords.json(1, 15000, "2024-01-01T03:00:00+03:00"));

    assertThat(record.getAgentData().getTimestamp().getOffset()).isEqualTo(ZoneOffset.ofHours(3));
    assertThat(record.getAgentData().getTimestamp().toInstant()).isEqualTo(TestRecords.TIMESTAMP.toInstant());
  }

  @Test
  @DisplayName("Время без часового пояса → ошибка проверки")
  void shouldRejectTimestampWithoutOffset() {
    assertThatThrownBy(() -> RecordParser.parse(TestRecords.json(1, 15000, "2024-01-01T00:00:00")))
        .isInstanceOfSatisfying(ValidationException.class,
            e -> assertThat(e.getField()).isEqualTo("agent_data.timestamp"));
  }

  @Test
  @DisplayName("Некорректное время → ошибка проверки")
  void shouldRejectMalformedTimestamp() {
    assertThatThrownBy(() -> RecordParser.parse(TestRecords.json(1, 15000, "yesterday")))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("yesterday");
  }

  @Test
  @DisplayName("Отсутствующее обязательное поле → ошибка проверки с путём поля")
  void shouldRejectMissingField() {
    ObjectNode json = TestRecords.json(1, 15000, "2024-01-01T00:00:00Z");
    ((ObjectNode) json.get("agent_data")).remove("gps");

    assertThatThrownBy(() -> RecordParser.parse(json))
        .isInstanceOfSatisfying(ValidationException.class,
            e -> assertThat(e.getField()).isEqualTo("agent_data.gps"));
  }

  @Test
  @DisplayName("Отрицательный или дробный user_id → ошибка проверки")
  void shouldRejectInvalidUserId() {
    assertThatThrownBy(() -> RecordParser.parse(TestRecords.json(-1, 15000)))
        .isInstanceOf(ValidationException.class);

    ObjectNode json = TestRecords.json(1, 15000, "2024-01-01T00:00:00Z");
    ((ObjectNode) json.get("agent_data")).put("user_id", 1.5);
    assertThatThrownBy(() -> RecordParser.parse(json))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  @DisplayName("Координаты вне допустимого диапазона → ошибка проверки")
  void shouldRejectOutOfRangeCoordinates() {
    ObjectNode json = TestRecords.json(1, 15000, "2024-01-01T00:00:00Z");
    ((ObjectNode) json.get("agent_data").get("gps")).put("latitude", 91.0);

    assertThatThrownBy(() -> RecordParser.parse(json))
        .isInstanceOfSatisfying(ValidationException.class,
            e -> assertThat(e.getField()).isEqualTo("agent_data.gps.latitude"));
  }

  @Test
  @DisplayName("Неизвестное состояние дороги или строка вместо числа → ошибка проверки")
  void shouldRejectWrongTypes() {
    ObjectNode badState = TestRecords.json(1, 15000, "2024-01-01T00:00:00Z");
    badState.put("road_state", "bumpy");
    assertThatThrownBy(() -> RecordParser.parse(badState))
        .isInstanceOfSatisfying(ValidationException.class,
            e -> assertThat(e.getField()).isEqualTo("road_state"));

    ObjectNode badNumber = TestRecords.json(1, 15000, "2024-01-01T00:00:00Z");
    ((ObjectNode) badNumber.get("agent_data").get("accelerometer")).put("z", "high");
    assertThatThrownBy(() -> RecordParser.parse(badNumber))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  @DisplayName("Не объект → ошибка проверки")
  void shouldRejectNonObject() {
    assertThatThrownBy(() -> RecordParser.parse(Json.mapper().getNodeFactory().textNode("record")))
        .isInstanceOf(ValidationException.class);
  }
}
