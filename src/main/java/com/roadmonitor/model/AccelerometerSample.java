package com.roadmonitor.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Показания акселерометра по трём осям (сырые значения датчика).
 */
public final class AccelerometerSample {

  private final double x;
  private final double y;
  private final double z;

  public AccelerometerSample(double x, double y, double z) {
    this.x = x;
    this.y = y;
    this.z = z;
  }

  @JsonProperty("x")
  public double getX() {
    return x;
  }

  @JsonProperty("y")
  public double getY() {
    return y;
  }

  /**
   * Вертикальная составляющая; по ней определяется состояние дороги.
   */
  @JsonProperty("z")
  public double getZ() {
    return z;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AccelerometerSample)) {
      return false;
    }
    AccelerometerSample that = (AccelerometerSample) o;
    return Double.compare(x, that.x) == 0
        && Double.compare(y, that.y) == 0
        && Double.compare(z, that.z) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(x, y, z);
  }

  @Override
  public String toString() {
    return "AccelerometerSample{x=" + x + ", y=" + y + ", z=" + z + "}";
  }
}
