package com.roadmonitor.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Координаты GPS в градусах.
 */
public final class GpsSample {

  private final double latitude;
  private final double longitude;

  public GpsSample(double latitude, double longitude) {
    this.latitude = latitude;
    this.longitude = longitude;
  }

  @JsonProperty("latitude")
  public double getLatitude() {
    return latitude;
  }

  @JsonProperty("longitude")
  public double getLongitude() {
    return longitude;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof GpsSample)) {
      return false;
    }
    GpsSample that = (GpsSample) o;
    return Double.compare(latitude, that.latitude) == 0
        && Double.compare(longitude, that.longitude) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(latitude, longitude);
  }

  @Override
  public String toString() {
    return "GpsSample{latitude=" + latitude + ", longitude=" + longitude + "}";
  }
}
