/*
 * どこで: Mmlogic サービス層
 * 何を: cardinality probe の結果で filter の取得を打ち切ったことを表現する
 * なぜ: store 障害 (StoreException) と区別して orchestrator が方針を選べるようにするため
 */
package com.example.mmlogic.service;

import com.example.mmlogic.model.Filter;

public abstract class FilterRejectedException extends RuntimeException {

  private final transient Filter filter;
  private final long count;

  protected FilterRejectedException(String message, Filter filter, long count) {
    super(message);
    this.filter = filter;
    this.count = count;
  }

  public Filter filter() {
    return filter;
  }

  public long count() {
    return count;
  }
}
