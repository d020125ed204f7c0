package com.example.mmlogic.service;

import com.example.mmlogic.model.FilterResult;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 候補 player id の順序付き集合。intersection は引数側の走査順を採用するため、最終的な並びは最後に
 * 畳み込んだ filter の store 走査順になる (集合としての結果は畳み込み順に依存しない)。
 */
final class CandidateSet {

  private final Set<String> playerIds;

  private CandidateSet(Set<String> playerIds) {
    this.playerIds = playerIds;
  }

  static CandidateSet of(FilterResult result) {
    return new CandidateSet(new LinkedHashSet<>(result.playerIds()));
  }

  static CandidateSet intersectAll(List<FilterResult> results) {
    if (results.isEmpty()) {
      return new CandidateSet(new LinkedHashSet<>());
    }
    CandidateSet overlap = of(results.get(0));
    for (int i = 1; i < results.size() && !overlap.isEmpty(); i++) {
      overlap = overlap.intersect(results.get(i));
    }
    return overlap;
  }

  CandidateSet intersect(FilterResult next) {
    final Set<String> retained = new LinkedHashSet<>();
    for (String playerId : next.playerIds()) {
      if (playerIds.contains(playerId)) {
        retained.add(playerId);
      }
    }
    return new CandidateSet(retained);
  }

  CandidateSet subtract(Collection<String> excluded) {
    if (excluded.isEmpty()) {
      return this;
    }
    final Set<String> remaining = new LinkedHashSet<>(playerIds);
    remaining.removeAll(excluded instanceof Set<?> ? excluded : Set.copyOf(excluded));
    return new CandidateSet(remaining);
  }

  boolean isEmpty() {
    return playerIds.isEmpty();
  }

  int size() {
    return playerIds.size();
  }

  List<String> toList() {
    return List.copyOf(playerIds);
  }
}
