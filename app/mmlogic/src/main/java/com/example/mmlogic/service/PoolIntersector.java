package com.example.mmlogic.service;

import com.example.mmlogic.model.FilterResult;
import com.example.mmlogic.model.PlayerPool;
import com.example.mmlogic.model.PoolCandidates;
import com.example.mmlogic.model.Stats;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * player pool の filter 群を評価し、全 filter の AND から ignore list を除いた候補を作る。
 *
 * <p>filter が 1 つも無い pool は候補の母集団が定義されないため空集合とする。いずれかの filter が
 * 0 件なら AND も空になるので、残りの filter と ignore list を読まずに空の候補を返す。
 */
@Component
public class PoolIntersector {

  private static final Logger logger = LoggerFactory.getLogger(PoolIntersector.class);

  private final FilterEvaluationStrategy evaluationStrategy;
  private final IgnoreListAggregator ignoreListAggregator;
  private final PoolQueryObserver observer;
  private final Clock clock;

  public PoolIntersector(
      FilterEvaluationStrategy evaluationStrategy,
      IgnoreListAggregator ignoreListAggregator,
      PoolQueryObserver observer,
      Clock clock) {
    this.evaluationStrategy = evaluationStrategy;
    this.ignoreListAggregator = ignoreListAggregator;
    this.observer = observer;
    this.clock = clock;
  }

  public PoolCandidates intersect(PlayerPool pool, PoolQueryContext context) {
    final long startedAt = System.nanoTime();
    if (pool.filters().isEmpty()) {
      logger.info("player pool has no filters, returning empty pool pool={}", pool.id());
      observer.recordEvent(PoolQueryEvents.POOL_WITHOUT_FILTERS, Map.of("pool", pool.id()));
      pool.updateStats(new Stats(0, elapsedSeconds(startedAt)));
      return PoolCandidates.empty(pool, null);
    }

    final FilterEvaluation evaluation = evaluationStrategy.evaluate(pool.filters(), context);
    if (evaluation.isShortCircuited()) {
      final String filterId = evaluation.emptyFilter().describe();
      logger.info(
          "this filter returned zero players, returning empty pool filterid={} pool={}",
          filterId,
          pool.id());
      observer.recordEvent(
          PoolQueryEvents.POOL_SHORT_CIRCUITED, Map.of("pool", pool.id(), "filter", filterId));
      pool.updateStats(new Stats(0, elapsedSeconds(startedAt)));
      return PoolCandidates.empty(pool, filterId);
    }

    final List<FilterResult> results = evaluation.results();
    final CandidateSet overlap = CandidateSet.intersectAll(results);
    logger.debug("amount of overlap pool={} count={}", pool.id(), overlap.size());
    final long highCardinalityFilters =
        results.stream().filter(FilterResult::highCardinality).count();

    CandidateSet remaining = overlap;
    int ignoredCount = 0;
    if (!overlap.isEmpty()) {
      context.checkActive();
      final Set<String> ignored = ignoreListAggregator.aggregate(clock.instant());
      ignoredCount = ignored.size();
      remaining = overlap.subtract(ignored);
    }
    logger.info(
        "pool size pool={} overlap={} ignorelist={} remaining={}",
        pool.id(),
        overlap.size(),
        ignoredCount,
        remaining.size());

    pool.updateStats(new Stats(remaining.size(), elapsedSeconds(startedAt)));
    observer.recordEvent(
        PoolQueryEvents.POOL_INTERSECTED,
        Map.of(
            "pool", pool.id(),
            "filters", results.size(),
            "overlap", overlap.size(),
            "count", remaining.size(),
            "high_cardinality_filters", highCardinalityFilters));
    return new PoolCandidates(pool, remaining.toList(), results, null);
  }

  private static double elapsedSeconds(long startedAtNanos) {
    return (System.nanoTime() - startedAtNanos) / 1e9;
  }
}
