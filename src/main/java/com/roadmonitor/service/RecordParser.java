package com.roadmonitor.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.roadmonitor.model.AccelerometerSample;
import com.roadmonitor.model.AgentRecord;
import com.roadmonitor.model.GpsSample;
import com.roadmonitor.model.ProcessedRecord;
import com.roadmonitor.model.RoadState;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Разбор и проверка записи из JSON:
 * <pre>
 * {"road_state": "normal",
 *  "agent_data": {"user_id": 1,
 *                 "accelerometer": {"x": 0, "y": 0, "z": 15000},
 *                 "gps": {"latitude": 50.0, "longitude": 30.0},
 *                 "timestamp": "2024-01-01T00:00:00Z"}}
 * </pre>
 * Время обязательно должно содержать смещение часового пояса.
 */
public final class RecordParser {

  private RecordParser() {
  }

  /**
   * @throws ValidationException если запись некорректна.
   */
  public static ProcessedRecord parse(JsonNode node) {
    requireObject(node, "record");
    String roadStateText = requireText(node, "road_state", "road_state");
    RoadState roadState;
    try {
      roadState = RoadState.fromValue(roadStateText);
    } catch (IllegalArgumentException e) {
      throw new ValidationException("road_state", "неизвестное значение '" + roadStateText + "'", e);
    }
    return new ProcessedRecord(roadState, parseAgentRecord(requireField(node, "agent_data", "agent_data")));
  }

  public static AgentRecord parseAgentRecord(JsonNode node) {
    requireObject(node, "agent_data");

    JsonNode userIdNode = requireField(node, "user_id", "agent_data.user_id");
    if (!userIdNode.isIntegralNumber() || !userIdNode.canConvertToInt() || userIdNode.intValue() < 0) {
      throw new ValidationException("agent_data.user_id", "ожидается неотрицательное целое число");
    }

    JsonNode acc = requireField(node, "accelerometer", "agent_data.accelerometer");
    requireObject(acc, "agent_data.accelerometer");
    AccelerometerSample accelerometer = new AccelerometerSample(
        requireNumber(acc, "x", "agent_data.accelerometer.x"),
        requireNumber(acc, "y", "agent_data.accelerometer.y"),
        requireNumber(acc, "z", "agent_data.accelerometer.z"));

    JsonNode gpsNode = requireField(node, "gps", "agent_data.gps");
    requireObject(gpsNode, "agent_data.gps");
    double latitude = requireNumber(gpsNode, "latitude", "agent_data.gps.latitude");
    double longitude = requireNumber(gpsNode, "longitude", "agent_data.gps.longitude");
    if (latitude < -90 || latitude > 90) {
      throw new ValidationException("agent_data.gps.latitude", "вне диапазона [-90, 90]: " + latitude);
    }
    if (longitude < -180 || longitude > 180) {
      throw new ValidationException("agent_data.gps.longitude", "вне диапазона [-180, 180]: " + longitude);
    }

    return new AgentRecord(userIdNode.intValue(), accelerometer, new GpsSample(latitude, longitude),
        parseTimestamp(requireText(node, "timestamp", "agent_data.timestamp")));
  }

  private static OffsetDateTime parseTimestamp(String text) {
    try {
      return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    } catch (DateTimeParseException e) {
      throw new ValidationException("agent_data.timestamp",
          "ожидается ISO 8601 с часовым поясом (YYYY-MM-DDTHH:MM:SSZ), получено '" + text + "'", e);
    }
  }

  private static void requireObject(JsonNode node, String path) {
    if (node == null || !node.isObject()) {
      throw new ValidationException(path, "ожидается JSON-объект");
    }
  }

  private static JsonNode requireField(JsonNode parent, String name, String path) {
    JsonNode value = parent.get(name);
    if (value == null || value.isNull()) {
      throw new ValidationException(path, "обязательное поле отсутствует");
    }
    return value;
  }

  private static String requireText(JsonNode parent, String name, String path) {
    JsonNode value = requireField(parent, name, path);
    if (!value.isTextual()) {
      throw new ValidationException(path, "ожидается строка");
    }
    return value.textValue();
  }

  private static double requireNumber(JsonNode parent, String name, String path) {
    JsonNode value = requireField(parent, name, path);
    if (!value.isNumber() || !Double.isFinite(value.doubleValue())) {
      throw new ValidationException(path, "ожидается число");
    }
    return value.doubleValue();
  }
}
