/*
 * どこで: Mmlogic ドメインモデル
 * 何を: filter の並びと集計統計を持つ player pool リクエストを表現する
 * なぜ: エンジンが処理中に統計を書き戻す対象を明示するため
 */
package com.example.mmlogic.model;

import java.util.List;
import java.util.Objects;

public final class PlayerPool {

  private final String id;
  private final List<Filter> filters;
  private volatile Stats stats;

  public PlayerPool(String id, List<Filter> filters) {
    this.id = Objects.requireNonNull(id, "id");
    this.filters = filters == null ? List.of() : List.copyOf(filters);
  }

  public String id() {
    return id;
  }

  public List<Filter> filters() {
    return filters;
  }

  public Stats stats() {
    return stats;
  }

  public void updateStats(Stats value) {
    this.stats = value;
  }
}
