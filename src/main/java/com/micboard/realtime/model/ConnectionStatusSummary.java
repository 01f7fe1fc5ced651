package com.micboard.realtime.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConnectionStatusSummary {
  int total;
  int connected;
  int connecting;
  int disconnected;
  int error;
  int stopped;
  double healthyPercentage;
  double averageErrorCount;
}
