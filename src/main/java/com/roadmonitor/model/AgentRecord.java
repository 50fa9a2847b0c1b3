package com.roadmonitor.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Один замер агента: акселерометр + GPS, снятые в момент {@code timestamp}.
 * <p>
 * Создаётся при захвате данных и после этого не изменяется.
 */
public final class AgentRecord {

  private final int userId;
  private final AccelerometerSample accelerometer;
  private final GpsSample gps;
  private final OffsetDateTime timestamp;

  /**
   * @param userId        Идентификатор источника (пользователя/устройства), не меньше 0.
   * @param accelerometer Показания акселерометра.
   * @param gps           Координаты.
   * @param timestamp     Момент замера с часовым поясом.
   */
  public AgentRecord(int userId, AccelerometerSample accelerometer, GpsSample gps, OffsetDateTime timestamp) {
    if (userId < 0) {
      throw new IllegalArgumentException("user_id не может быть отрицательным: " + userId);
    }
    this.userId = userId;
    this.accelerometer = Objects.requireNonNull(accelerometer, "accelerometer");
    this.gps = Objects.requireNonNull(gps, "gps");
    this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
  }

  @JsonProperty("user_id")
  public int getUserId() {
    return userId;
  }

  @JsonProperty("accelerometer")
  public AccelerometerSample getAccelerometer() {
    return accelerometer;
  }

  @JsonProperty("gps")
  public GpsSample getGps() {
    return gps;
  }

  @JsonProperty("timestamp")
  public OffsetDateTime getTimestamp() {
    return timestamp;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AgentRecord)) {
      return false;
    }
    AgentRecord that = (AgentRecord) o;
    return userId == that.userId
        && accelerometer.equals(that.accelerometer)
        && gps.equals(that.gps)
        && timestamp.isEqual(that.timestamp);
  }

  @Override
  public int hashCode() {
    return Objects.hash(userId, accelerometer, gps, timestamp.toInstant());
  }

  @Override
  public String toString() {
    return "AgentRecord{userId=" + userId + ", accelerometer=" + accelerometer
        + ", gps=" + gps + ", timestamp=" + timestamp + "}";
  }
}
