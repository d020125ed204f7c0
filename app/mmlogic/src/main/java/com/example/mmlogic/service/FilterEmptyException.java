package com.example.mmlogic.service;

import com.example.mmlogic.model.Filter;

/** filter に一致する player が 0 件。エラーではなく空 roster の fast path として扱う。 */
public class FilterEmptyException extends FilterRejectedException {

  public FilterEmptyException(Filter filter) {
    super("filter matched no players: " + filter.describe(), filter, 0);
  }
}
