package com.example.mmlogic.service;

import com.example.mmlogic.model.Filter;

public class FilterTooLargeException extends FilterRejectedException {

  private final long limit;

  public FilterTooLargeException(Filter filter, long count, long limit) {
    super(
        "filter matches too many players: filter="
            + filter.describe()
            + " count="
            + count
            + " limit="
            + limit,
        filter,
        count);
    this.limit = limit;
  }

  public long limit() {
    return limit;
  }
}
