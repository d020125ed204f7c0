/*
 * どこで: Mmlogic サービス層
 * 何を: エンジン各コンポーネントのイベント/エラー通知口を定義する
 * なぜ: ログとメトリクスをグローバル状態にせず、コンポーネントへ注入して差し替え可能にするため
 */
package com.example.mmlogic.service;

import java.util.Map;

public interface PoolQueryObserver {

  void recordEvent(String event, Map<String, ?> fields);

  void recordError(String event, Throwable error, Map<String, ?> fields);
}
