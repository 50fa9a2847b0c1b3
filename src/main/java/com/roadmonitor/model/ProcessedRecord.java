package com.roadmonitor.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Замер агента вместе с вычисленным состоянием дороги.
 */
public final class ProcessedRecord {

  private final RoadState roadState;
  private final AgentRecord agentData;

  public ProcessedRecord(RoadState roadState, AgentRecord agentData) {
    this.roadState = Objects.requireNonNull(roadState, "roadState");
    this.agentData = Objects.requireNonNull(agentData, "agentData");
  }

  @JsonProperty("road_state")
  public RoadState getRoadState() {
    return roadState;
  }

  @JsonProperty("agent_data")
  public AgentRecord getAgentData() {
    return agentData;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ProcessedRecord)) {
      return false;
    }
    ProcessedRecord that = (ProcessedRecord) o;
    return roadState == that.roadState && agentData.equals(that.agentData);
  }

  @Override
  public int hashCode() {
    return Objects.hash(roadState, agentData);
  }

  @Override
  public String toString() {
    return "ProcessedRecord{roadState=" + roadState + ", agentData=" + agentData + "}";
  }
}
