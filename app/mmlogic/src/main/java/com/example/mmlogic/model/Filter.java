/*
 * どこで: Mmlogic ドメインモデル
 * 何を: 1 つの数値属性に対する範囲条件を表現する
 * なぜ: Range Filter の入力と評価後の統計を 1 か所で保持するため
 */
package com.example.mmlogic.model;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

public final class Filter {

  private final String id;
  private final String name;
  private final String field;
  private final long minv;
  private final Long maxv;
  private final AtomicReference<Stats> stats = new AtomicReference<>();

  public Filter(String id, String name, String field, long minv, Long maxv) {
    this.id = id;
    this.name = name;
    this.field = Objects.requireNonNull(field, "field");
    this.minv = minv;
    this.maxv = maxv;
  }

  public String id() {
    return id;
  }

  public String name() {
    return name;
  }

  public String field() {
    return field;
  }

  public long minv() {
    return minv;
  }

  public Long maxv() {
    return maxv;
  }

  /** 上限未指定 (null または 0) は +inf として扱う。 */
  public double upperBound() {
    return maxv == null || maxv == 0 ? Double.POSITIVE_INFINITY : maxv.doubleValue();
  }

  public boolean isBounded() {
    return !Double.isInfinite(upperBound());
  }

  /**
   * 役割: 評価結果の統計を filter へ付与する。
   * 動作: 1 回目のみ受け付け、2 回目以降は IllegalStateException を送出する。
   */
  public void attachStats(Stats value) {
    if (!stats.compareAndSet(null, Objects.requireNonNull(value, "stats"))) {
      throw new IllegalStateException("stats already attached to filter: " + describe());
    }
  }

  /** 評価前は null。 */
  public Stats stats() {
    return stats.get();
  }

  /** ログ/エラーメッセージ用に id が無ければ field 名で代用する。 */
  public String describe() {
    return id == null || id.isBlank() ? field : id;
  }

  @Override
  public String toString() {
    return "Filter[id=" + id + ", field=" + field + ", minv=" + minv + ", maxv=" + maxv + "]";
  }
}
