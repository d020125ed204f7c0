package com.example.mmlogic.api.response;

import com.example.mmlogic.model.Filter;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FilterResponse(
    String id, String name, String field, long minv, Long maxv, StatsResponse stats) {

  public static FilterResponse from(Filter filter) {
    return new FilterResponse(
        filter.id(),
        filter.name(),
        filter.field(),
        filter.minv(),
        filter.maxv(),
        StatsResponse.from(filter.stats()));
  }
}
