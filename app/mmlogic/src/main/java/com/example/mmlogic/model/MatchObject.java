/*
 * どこで: Mmlogic ドメインモデル
 * 何を: MMF が作成した proposal (match object) を表現する
 * なぜ: proposal 登録で ignore list 更新と queue 追加に必要な情報を渡すため
 */
package com.example.mmlogic.model;

import java.util.List;

public record MatchObject(String id, String properties, List<Roster> rosters) {

  public MatchObject {
    rosters = rosters == null ? List.of() : List.copyOf(rosters);
  }

  public List<String> playerIds() {
    return rosters.stream().flatMap(roster -> roster.playerIds().stream()).toList();
  }
}
