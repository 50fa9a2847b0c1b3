package com.roadmonitor.model;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsonTest {

  @Test
  @DisplayName("ProcessedRecord сериализуется в формат агента с snake_case и ISO-временем")
  void shouldSerializeProcessedRecordInWireFormat() throws Exception {
    ProcessedRecord record = new ProcessedRecord(RoadState.SMALL_PITS,
        new AgentRecord(7, new AccelerometerSample(1.5, -2.0, 13000), new GpsSample(50.45, 30.52), TestRecords.TIMESTAMP));

    JsonNode json = Json.mapper().readTree(Json.toJson(record));

    assertThat(json.get("road_state").asText()).isEqualTo("small_pits");
    JsonNode agent = json.get("agent_data");
    assertThat(agent.get("user_id").asInt()).isEqualTo(7);
    assertThat(agent.get("accelerometer").get("z").asDouble()).isEqualTo(13000.0);
    assertThat(agent.get("gps").get("latitude").asDouble()).isEqualTo(50.45);
    assertThat(agent.get("timestamp").asText()).isEqualTo("2024-01-01T00:00:00Z");
  }

  @Test
  @DisplayName("StoredRecord сериализуется в плоскую форму с id")
  void shouldSerializeStoredRecordFlat() throws Exception {
    StoredRecord stored = new StoredRecord(42, TestRecords.processed(1, 15000));

    JsonNode json = Json.mapper().readTree(Json.toJson(stored));

    assertThat(json.get("id").asLong()).isEqualTo(42);
    assertThat(json.get("road_state").asText()).isEqualTo("normal");
    assertThat(json.get("user_id").asInt()).isEqualTo(1);
    assertThat(json.get("z").asDouble()).isEqualTo(15000.0);
    assertThat(json.get("longitude").asDouble()).isEqualTo(30.0);
    assertThat(json.get("timestamp").asText()).isEqualTo("2024-01-01T00:00:00Z");
    assertThat(json.has("agent_data")).isFalse();
  }

  @Test
  @DisplayName("RoadState принимает написание через пробел")
  void shouldParseRoadStateSpelledWithSpace() {
    assertThat(RoadState.fromValue("small pits")).isEqualTo(RoadState.SMALL_PITS);
    assertThat(RoadState.fromValue("LARGE_PITS")).isEqualTo(RoadState.LARGE_PITS);
  }
}
