/*
 * どこで: Mmlogic ドメインモデル
 * 何を: 1 つの filter に一致した player id と値の対応を保持する
 * なぜ: intersection 後に一致値を player へ付け直すため
 */
package com.example.mmlogic.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public final class FilterResult {

  private final Filter filter;
  private final Map<String, Long> values;
  private final boolean highCardinality;

  public FilterResult(Filter filter, Map<String, Long> values, boolean highCardinality) {
    this.filter = filter;
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    this.highCardinality = highCardinality;
  }

  public FilterResult(Filter filter, Map<String, Long> values) {
    this(filter, values, false);
  }

  public Filter filter() {
    return filter;
  }

  public String field() {
    return filter.field();
  }

  /** store の走査順を保った id 集合。 */
  public Set<String> playerIds() {
    return values.keySet();
  }

  public boolean contains(String playerId) {
    return values.containsKey(playerId);
  }

  public Long valueOf(String playerId) {
    return values.get(playerId);
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  /** probe 件数が警告閾値以上だったか。 */
  public boolean highCardinality() {
    return highCardinality;
  }

  public Map<String, Long> values() {
    return values;
  }
}
