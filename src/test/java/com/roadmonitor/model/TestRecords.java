package com.roadmonitor.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Готовые записи для тестов.
 */
public final class TestRecords {

  public static final OffsetDateTime TIMESTAMP = OffsetDateTime.of(2024, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

  private TestRecords() {
  }

  public static AgentRecord agent(int userId, double z) {
    return new AgentRecord(userId, new AccelerometerSample(0, 0, z), new GpsSample(50.0, 30.0), TIMESTAMP);
  }

  public static ProcessedRecord processed(int userId, double z) {
    return new ProcessedRecord(RoadState.NORMAL, agent(userId, z));
  }

  /**
   * JSON-форма записи, как её присылает агент.
   */
  public static ObjectNode json(int userId, double z, String timestamp) {
    ObjectNode root = Json.mapper().createObjectNode();
    root.put("road_state", "normal");
    ObjectNode agent = root.putObject("agent_data");
    agent.put("user_id", userId);
    ObjectNode acc = agent.putObject("accelerometer");
    acc.put("x", 0.0);
    acc.put("y", 0.0);
    acc.put("z", z);
    ObjectNode gps = agent.putObject("gps");
    gps.put("latitude", 50.0);
    gps.put("longitude", 30.0);
    agent.put("timestamp", timestamp);
    return root;
  }

  public static JsonNode json(int userId, double z) {
    return json(userId, z, "2024-01-01T00:00:00Z");
  }
}
