/*
 * どこで: Mmlogic サービス層
 * 何を: pool 内の filter 群を評価する方式 (逐次/並行) を抽象化する
 * なぜ: 「最初に 0 件になった filter で残りを止める」挙動を方式によらず揃えるため
 */
package com.example.mmlogic.service;

import com.example.mmlogic.model.Filter;
import java.util.List;

public interface FilterEvaluationStrategy {

  /**
   * 役割: filters を RangeFilterApplier で評価する。
   * 動作: いずれかが 0 件なら残りを評価せず (評価中なら取り消して) short-circuit の結果を返す。
   * FilterTooLargeException / StoreException はそのまま送出する。
   */
  FilterEvaluation evaluate(List<Filter> filters, PoolQueryContext context);
}
