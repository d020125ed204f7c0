/*
 * どこで: Mmlogic Repository 層
 * 何を: 属性ごとの sorted set index への範囲クエリを抽象化する
 * なぜ: Range Filter Applier を Redis 実装から切り離し、呼び出し回数を検証できるようにするため
 */
package com.example.mmlogic.repository;

import com.example.mmlogic.model.IndexedValue;
import java.util.List;

public interface PlayerIndexRepository {

  /**
   * 役割: field の index で [min, max] に入るエントリ数を返す (ZCOUNT 相当)。
   * 動作: index が存在しない場合は 0 を返す。
   * 前提: max は +inf を取りうる。
   */
  long countInRange(String field, double min, double max);

  /**
   * 役割: field の index から [min, max] のエントリを score 昇順で最大 count 件返す
   * (ZRANGEBYSCORE ... WITHSCORES LIMIT offset count 相当)。
   * 動作: 範囲外の offset なら空リストを返す。
   */
  List<IndexedValue> rangeWithValues(String field, double min, double max, long offset, long count);
}
