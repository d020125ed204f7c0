package com.example.mmlogic.service;

import com.example.mmlogic.model.Filter;
import com.example.mmlogic.model.FilterResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.AsyncTaskExecutor;

/**
 * filter を executor 上で並行に評価する。最初に 0 件 / 失敗で完了した filter で残りの評価を
 * 割り込みで取り消す。取り消された filter には Stats が付与されないことがある。
 */
public class ConcurrentFilterEvaluation implements FilterEvaluationStrategy {

  private static final Logger logger = LoggerFactory.getLogger(ConcurrentFilterEvaluation.class);
  private static final long POLL_INTERVAL_MILLIS = 50;

  private final RangeFilterApplier applier;
  private final AsyncTaskExecutor executor;

  public ConcurrentFilterEvaluation(RangeFilterApplier applier, AsyncTaskExecutor executor) {
    this.applier = applier;
    this.executor = executor;
  }

  @Override
  public FilterEvaluation evaluate(List<Filter> filters, PoolQueryContext context) {
    final CompletionService<FilterResult> completion = new ExecutorCompletionService<>(executor);
    final Map<Future<FilterResult>, Filter> pending =
        Collections.synchronizedMap(new IdentityHashMap<>());
    final Runnable cancelAll = () -> cancel(pending);
    context.onCancel(cancelAll);
    try {
      for (Filter filter : filters) {
        pending.put(completion.submit(() -> applier.apply(filter, context)), filter);
      }
      final Map<Filter, FilterResult> completed = new IdentityHashMap<>();
      int remaining = filters.size();
      while (remaining > 0) {
        context.checkActive();
        final Future<FilterResult> done = completion.poll(POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
        if (done == null) {
          continue;
        }
        final Filter filter = pending.remove(done);
        remaining--;
        try {
          completed.put(filter, done.get());
        } catch (ExecutionException ex) {
          if (ex.getCause() instanceof FilterEmptyException) {
            logger.debug("filter returned no players, cancelling {} others", pending.size());
            return FilterEvaluation.shortCircuited(inFilterOrder(filters, completed), filter);
          }
          throw propagate(ex.getCause());
        }
      }
      return FilterEvaluation.completed(inFilterOrder(filters, completed));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new PoolQueryCancelledException(context.poolId(), "interrupted");
    } finally {
      cancel(pending);
    }
  }

  private List<FilterResult> inFilterOrder(List<Filter> filters, Map<Filter, FilterResult> done) {
    final List<FilterResult> ordered = new ArrayList<>(done.size());
    for (Filter filter : filters) {
      final FilterResult result = done.get(filter);
      if (result != null) {
        ordered.add(result);
      }
    }
    return ordered;
  }

  private void cancel(Map<Future<FilterResult>, Filter> pending) {
    synchronized (pending) {
      for (Future<FilterResult> future : pending.keySet()) {
        future.cancel(true);
      }
    }
  }

  private RuntimeException propagate(Throwable cause) {
    if (cause instanceof RuntimeException runtime) {
      return runtime;
    }
    if (cause instanceof Error error) {
      throw error;
    }
    return new IllegalStateException("filter evaluation failed", cause);
  }
}
