package com.example.mmlogic.service;

import com.example.mmlogic.config.MmlogicProperties;
import com.example.mmlogic.model.PlayerPool;
import com.example.mmlogic.model.PoolCandidates;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * player pool 取得の入口。
 *
 * <p>{@link #prepare} で filter 評価・intersection・ignore list 除外までを終わらせ、{@link #stream} で
 * ページを送る。応答開始前に失敗を確定させるため 2 段階に分けている。
 */
@Service
public class PlayerPoolService {

  static final String METHOD = "GetPlayerPool";
  public static final String MDC_POOL_ID = "pool_id";

  private static final Logger logger = LoggerFactory.getLogger(PlayerPoolService.class);

  private final PoolIntersector poolIntersector;
  private final ResultPaginator resultPaginator;
  private final MmlogicMetrics metrics;
  private final Duration queryTimeout;

  public PlayerPoolService(
      PoolIntersector poolIntersector,
      ResultPaginator resultPaginator,
      MmlogicMetrics metrics,
      MmlogicProperties properties) {
    this.poolIntersector = poolIntersector;
    this.resultPaginator = resultPaginator;
    this.metrics = metrics;
    this.queryTimeout = properties.queryTimeout();
  }

  /**
   * 役割: pool を評価して送信可能な候補を作る。
   * 動作: 失敗時は context を閉じて例外をそのまま送出する。
   */
  public PreparedPlayerPool prepare(PlayerPool pool) {
    metrics.recordApiRequest(METHOD);
    final PoolQueryContext context = PoolQueryContext.withTimeout(pool.id(), queryTimeout);
    try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_POOL_ID, pool.id())) {
      final PoolCandidates candidates = poolIntersector.intersect(pool, context);
      return new PreparedPlayerPool(candidates, context);
    } catch (RuntimeException ex) {
      metrics.recordApiError(METHOD);
      logger.debug("error applying filters pool={}", pool.id(), ex);
      context.cancel("failed");
      throw ex;
    }
  }

  /**
   * 役割: 準備済み pool をページ送信する。
   * 動作: 成否にかかわらず context を閉じる。送信中は MDC に pool_id を積む。
   */
  public int stream(PreparedPlayerPool prepared, RosterPageSink sink) {
    try (PoolQueryContext context = prepared.context();
        MDC.MDCCloseable ignored = MDC.putCloseable(MDC_POOL_ID, context.poolId())) {
      return resultPaginator.stream(prepared.candidates(), sink, context);
    } catch (RuntimeException ex) {
      metrics.recordApiError(METHOD);
      throw ex;
    }
  }

  public int getPlayerPool(PlayerPool pool, RosterPageSink sink) {
    return stream(prepare(pool), sink);
  }
}
