package com.roadmonitor.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Плоское представление записи в хранилище: строка таблицы processed_agent_data.
 */
public final class StoredRecord {

  private final long id;
  private final ProcessedRecord record;

  public StoredRecord(long id, ProcessedRecord record) {
    this.id = id;
    this.record = Objects.requireNonNull(record, "record");
  }

  @JsonProperty("id")
  public long getId() {
    return id;
  }

  @JsonProperty("road_state")
  public RoadState getRoadState() {
    return record.getRoadState();
  }

  @JsonProperty("user_id")
  public int getUserId() {
    return record.getAgentData().getUserId();
  }

  @JsonProperty("x")
  public double getX() {
    return record.getAgentData().getAccelerometer().getX();
  }

  @JsonProperty("y")
  public double getY() {
    return record.getAgentData().getAccelerometer().getY();
  }

  @JsonProperty("z")
  public double getZ() {
    return record.getAgentData().getAccelerometer().getZ();
  }

  @JsonProperty("latitude")
  public double getLatitude() {
    return record.getAgentData().getGps().getLatitude();
  }

  @JsonProperty("longitude")
  public double getLongitude() {
    return record.getAgentData().getGps().getLongitude();
  }

  @JsonProperty("timestamp")
  public OffsetDateTime getTimestamp() {
    return record.getAgentData().getTimestamp();
  }

  /**
   * Исходная (вложенная) форма записи, в которой она пришла от агента.
   */
  public ProcessedRecord toProcessedRecord() {
    return record;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StoredRecord)) {
      return false;
    }
    StoredRecord that = (StoredRecord) o;
    return id == that.id && record.equals(that.record);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, record);
  }

  @Override
  public String toString() {
    return "StoredRecord{id=" + id + ", record=" + record + "}";
  }
}
