package com.example.mmlogic.service;

import com.example.mmlogic.model.Filter;
import com.example.mmlogic.model.FilterResult;
import java.util.List;

/**
 * filter 群の評価結果。emptyFilter が非 null のとき、その filter が 0 件で評価を打ち切ったことを表す。
 * results は pool の filter 順に並ぶ。
 */
public record FilterEvaluation(List<FilterResult> results, Filter emptyFilter) {

  public FilterEvaluation {
    results = List.copyOf(results);
  }

  public static FilterEvaluation completed(List<FilterResult> results) {
    return new FilterEvaluation(results, null);
  }

  public static FilterEvaluation shortCircuited(List<FilterResult> results, Filter emptyFilter) {
    return new FilterEvaluation(results, emptyFilter);
  }

  public boolean isShortCircuited() {
    return emptyFilter != null;
  }
}
