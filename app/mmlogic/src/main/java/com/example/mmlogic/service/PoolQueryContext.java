/*
 * どこで: Mmlogic サービス層
 * 何を: 1 件の player pool リクエストに紐づく取消/期限の状態を保持する
 * なぜ: store 呼び出しの合間とページ送信前に中断を判定し、途中の評価を止めるため
 */
package com.example.mmlogic.service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class PoolQueryContext implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(PoolQueryContext.class);

  private final String poolId;
  private final long deadlineNanos;
  private final AtomicReference<String> cancelReason = new AtomicReference<>();
  private final List<Runnable> cancelHooks = new CopyOnWriteArrayList<>();

  private PoolQueryContext(String poolId, long deadlineNanos) {
    this.poolId = poolId;
    this.deadlineNanos = deadlineNanos;
  }

  public static PoolQueryContext withTimeout(String poolId, Duration timeout) {
    return new PoolQueryContext(poolId, System.nanoTime() + timeout.toNanos());
  }

  public String poolId() {
    return poolId;
  }

  /**
   * 役割: 処理を継続してよいかを判定する。
   * 動作: 取消済み/期限切れ/スレッド割り込み時は PoolQueryCancelledException を送出する。
   */
  public void checkActive() {
    final String reason = cancelReason.get();
    if (reason != null) {
      throw new PoolQueryCancelledException(poolId, reason);
    }
    if (System.nanoTime() - deadlineNanos > 0) {
      cancel("deadline exceeded");
      throw new PoolQueryCancelledException(poolId, "deadline exceeded");
    }
    if (Thread.currentThread().isInterrupted()) {
      throw new PoolQueryCancelledException(poolId, "interrupted");
    }
  }

  public boolean isCancelled() {
    return cancelReason.get() != null;
  }

  /** 最初の呼び出しのみ hook を実行する。 */
  public void cancel(String reason) {
    if (!cancelReason.compareAndSet(null, reason)) {
      return;
    }
    for (Runnable hook : cancelHooks) {
      try {
        hook.run();
      } catch (RuntimeException ex) {
        logger.warn("cancel hook failed pool={}", poolId, ex);
      }
    }
    cancelHooks.clear();
  }

  /** 取消済みなら即座に実行する。 */
  public void onCancel(Runnable hook) {
    cancelHooks.add(hook);
    if (isCancelled() && cancelHooks.remove(hook)) {
      hook.run();
    }
  }

  @Override
  public void close() {
    cancel("completed");
  }
}
