package com.example.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /**
   * 役割: 上流から渡された相関 ID を採用し、無ければ新規に払い出す。
   * 動作: null/空白は未指定として扱う。
   */
  public static String resolve(String candidate) {
    if (candidate != null && !candidate.isBlank()) {
      return candidate.trim();
    }
    return newTraceId();
  }
}
