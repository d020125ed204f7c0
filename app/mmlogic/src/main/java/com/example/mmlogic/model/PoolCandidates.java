/*
 * どこで: Mmlogic ドメインモデル
 * 何を: intersection と ignore list 除外を終えた候補 id と filter ごとの値を保持する
 * なぜ: Pool Intersector から Result Paginator への受け渡し形を固定するため
 */
package com.example.mmlogic.model;

import java.util.List;

public record PoolCandidates(
    PlayerPool pool,
    List<String> playerIds,
    List<FilterResult> filterResults,
    String shortCircuitFilterId) {

  public PoolCandidates {
    playerIds = List.copyOf(playerIds);
    filterResults = List.copyOf(filterResults);
  }

  public static PoolCandidates empty(PlayerPool pool, String shortCircuitFilterId) {
    return new PoolCandidates(pool, List.of(), List.of(), shortCircuitFilterId);
  }

  public boolean isShortCircuited() {
    return shortCircuitFilterId != null;
  }

  public int size() {
    return playerIds.size();
  }
}
