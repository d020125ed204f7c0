package com.example.mmlogic.api.response;

import com.example.mmlogic.model.Stats;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StatsResponse(long count, double elapsed) {

  public static StatsResponse from(Stats stats) {
    return stats == null ? null : new StatsResponse(stats.count(), stats.elapsedSeconds());
  }
}
