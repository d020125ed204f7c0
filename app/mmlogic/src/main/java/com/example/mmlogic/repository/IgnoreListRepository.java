/*
 * どこで: Mmlogic Repository 層
 * 何を: 名前付き ignore list (追加時刻付き player id 集合) の操作を抽象化する
 * なぜ: proposal 登録と除外集合の取得を Redis 実装から切り離すため
 */
package com.example.mmlogic.repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface IgnoreListRepository {

  /** 役割: playerIds を addedAt の時刻で list へ追加する。既存 id は時刻を更新する。 */
  void append(String listKey, Collection<String> playerIds, Instant addedAt);

  /**
   * 役割: list から [from, until] の時刻に追加された player id を返す。
   * 動作: from が null なら下限なしで読む。
   */
  List<String> retrieve(String listKey, Instant from, Instant until);
}
