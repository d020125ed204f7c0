package com.example.mmlogic.service;

import com.example.mmlogic.model.Filter;
import com.example.mmlogic.model.FilterResult;
import java.util.ArrayList;
import java.util.List;

public class SequentialFilterEvaluation implements FilterEvaluationStrategy {

  private final RangeFilterApplier applier;

  public SequentialFilterEvaluation(RangeFilterApplier applier) {
    this.applier = applier;
  }

  @Override
  public FilterEvaluation evaluate(List<Filter> filters, PoolQueryContext context) {
    final List<FilterResult> results = new ArrayList<>(filters.size());
    for (Filter filter : filters) {
      context.checkActive();
      try {
        results.add(applier.apply(filter, context));
      } catch (FilterEmptyException ex) {
        return FilterEvaluation.shortCircuited(results, filter);
      }
    }
    return FilterEvaluation.completed(results);
  }
}
