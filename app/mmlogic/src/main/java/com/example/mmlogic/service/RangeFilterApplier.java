package com.example.mmlogic.service;

import com.example.mmlogic.config.MmlogicProperties;
import com.example.mmlogic.model.Filter;
import com.example.mmlogic.model.FilterResult;
import com.example.mmlogic.model.IndexedValue;
import com.example.mmlogic.model.Stats;
import com.example.mmlogic.repository.PlayerIndexRepository;
import com.example.mmlogic.repository.StoreException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 1 つの range filter を player index に対して評価する。
 *
 * <p>ZCOUNT 相当の probe で件数を確認してから、ZRANGEBYSCORE 相当の取得を fetch-page-size
 * 件ずつ繰り返す。取得中に index が更新されると同じ id がページ境界をまたいで再出現することがあるが、
 * その場合は後勝ちで上書きし、offset は新規に増えた id の数だけ進める (新規 0 件の満杯ページではページ幅分
 * 進める)。取得は件数がページ幅に満たないページで終える。スナップショット分離は行わない
 * (除外の正しさは ignore list 側で担保する)。
 */
@Component
public class RangeFilterApplier {

  private static final Logger logger = LoggerFactory.getLogger(RangeFilterApplier.class);

  private final PlayerIndexRepository indexRepository;
  private final MmlogicProperties.FilterProperties properties;
  private final PoolQueryObserver observer;

  public RangeFilterApplier(
      PlayerIndexRepository indexRepository,
      MmlogicProperties properties,
      PoolQueryObserver observer) {
    this.indexRepository = indexRepository;
    this.properties = properties.filter();
    this.observer = observer;
  }

  /**
   * 役割: filter に一致する player id と一致値の対応を返す。
   * 動作: 0 件なら FilterEmptyException、hard-limit 超過なら FilterTooLargeException、store 障害は
   * StoreException を送出する。成否にかかわらず filter へ件数と所要時間を付与する。
   * 前提: filter は未評価であること (Stats は 1 回しか付与できない)。
   */
  public FilterResult apply(Filter filter, PoolQueryContext context) {
    final long startedAt = System.nanoTime();
    long resultCount = 0;
    try {
      final FilterResult result = evaluate(filter, context);
      resultCount = result.size();
      return result;
    } finally {
      final double elapsedSeconds = (System.nanoTime() - startedAt) / 1e9;
      filter.attachStats(new Stats(resultCount, elapsedSeconds));
      observer.recordEvent(
          PoolQueryEvents.FILTER_PROCESSED,
          Map.of(
              "filter", filter.describe(),
              "field", filter.field(),
              "count", resultCount,
              "elapsed_seconds", elapsedSeconds));
    }
  }

  private FilterResult evaluate(Filter filter, PoolQueryContext context) {
    final String field = filter.field();
    final double min = filter.minv();
    final double max = filter.upperBound();

    context.checkActive();
    final long count = probe(filter, min, max);
    if (count == 0) {
      observer.recordEvent(
          PoolQueryEvents.FILTER_EMPTY, Map.of("filter", filter.describe(), "field", field));
      throw new FilterEmptyException(filter);
    }
    if (count > properties.hardLimit()) {
      observer.recordEvent(
          PoolQueryEvents.FILTER_TOO_LARGE,
          Map.of("filter", filter.describe(), "field", field, "count", count));
      throw new FilterTooLargeException(filter, count, properties.hardLimit());
    }
    final boolean highCardinality = count >= properties.softLimit();
    if (highCardinality) {
      logger.warn(
          "number of players this filter applies to is very large field={} count={}", field, count);
      observer.recordEvent(
          PoolQueryEvents.FILTER_HIGH_CARDINALITY,
          Map.of("filter", filter.describe(), "field", field, "count", count));
    } else {
      logger.info("number of players this filter applies to field={} count={}", field, count);
    }

    final Map<String, Long> values = fetch(filter, min, max, context);
    if (values.isEmpty()) {
      // probe 後に index から全件消えた
      throw new FilterEmptyException(filter);
    }
    logger.info(
        "player pool filter processed field={} minv={} maxv={} poolSize={}",
        field,
        filter.minv(),
        max,
        values.size());
    return new FilterResult(filter, values, highCardinality);
  }

  private long probe(Filter filter, double min, double max) {
    try {
      return indexRepository.countInRange(filter.field(), min, max);
    } catch (StoreException ex) {
      observer.recordError(
          PoolQueryEvents.FILTER_STORE_ERROR,
          ex,
          Map.of("query", ex.query(), "field", filter.field(), "minv", min, "maxv", max));
      throw ex;
    }
  }

  private Map<String, Long> fetch(
      Filter filter, double min, double max, PoolQueryContext context) {
    final int pageSize = properties.fetchPageSize();
    final long maxPages = properties.hardLimit() / pageSize + 2;
    final Map<String, Long> values = new LinkedHashMap<>();
    long offset = 0;

    for (long page = 0; page < maxPages; page++) {
      context.checkActive();
      final List<IndexedValue> chunk = fetchChunk(filter, min, max, offset, pageSize);
      int added = 0;
      for (IndexedValue value : chunk) {
        if (values.put(value.playerId(), value.value()) == null) {
          added++;
        }
      }
      if (chunk.size() < pageSize) {
        return values;
      }
      if (added < chunk.size()) {
        logger.debug(
            "index changed during retrieval field={} duplicates={}",
            filter.field(),
            chunk.size() - added);
      }
      // 全件が既出のページは前方への挿入で押し出された分なので、ページ幅だけ読み進める
      offset += added == 0 ? chunk.size() : added;
    }

    logger.warn("filter retrieval stopped at page bound field={} pages={}", filter.field(), maxPages);
    observer.recordEvent(
        PoolQueryEvents.FILTER_FETCH_BOUND_REACHED,
        Map.of("filter", filter.describe(), "field", filter.field(), "pages", maxPages));
    return values;
  }

  private List<IndexedValue> fetchChunk(
      Filter filter, double min, double max, long offset, int pageSize) {
    try {
      return indexRepository.rangeWithValues(filter.field(), min, max, offset, pageSize);
    } catch (StoreException ex) {
      observer.recordError(
          PoolQueryEvents.FILTER_STORE_ERROR,
          ex,
          Map.of(
              "query", ex.query(),
              "field", filter.field(),
              "minv", min,
              "maxv", max,
              "offset", offset,
              "count", pageSize));
      throw ex;
    }
  }
}
