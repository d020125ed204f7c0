package com.example.mmlogic.service;

/** PoolQueryObserver へ通知するイベント名。メトリクスの tag 値にもなる。 */
public final class PoolQueryEvents {
  private PoolQueryEvents() {}

  public static final String FILTER_PROCESSED = "filter_processed";
  public static final String FILTER_EMPTY = "filter_empty";
  public static final String FILTER_TOO_LARGE = "filter_too_large";
  public static final String FILTER_HIGH_CARDINALITY = "filter_high_cardinality";
  public static final String FILTER_FETCH_BOUND_REACHED = "filter_fetch_bound_reached";
  public static final String FILTER_STORE_ERROR = "filter_store_error";
  public static final String IGNORE_LIST_RETRIEVED = "ignore_list_retrieved";
  public static final String IGNORE_LIST_STORE_ERROR = "ignore_list_store_error";
  public static final String POOL_SHORT_CIRCUITED = "pool_short_circuited";
  public static final String POOL_WITHOUT_FILTERS = "pool_without_filters";
  public static final String POOL_INTERSECTED = "pool_intersected";
  public static final String PAGE_SENT = "page_sent";
  public static final String PAGE_SEND_FAILED = "page_send_failed";
}
