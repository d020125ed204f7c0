/*
 * どこで: Mmlogic ドメインモデル
 * 何を: stream で 1 回に送る player pool のページを表現する
 * なぜ: 呼び出し側が pool 全体を再構成できる最小単位を固定するため
 */
package com.example.mmlogic.model;

import java.util.List;

public record RosterPage(
    String id, int pageIndex, int pageCount, List<Filter> filters, Stats stats, Roster roster) {

  public RosterPage {
    filters = filters == null ? List.of() : List.copyOf(filters);
  }

  public static String pageId(String poolId, int pageIndex, int pageCount) {
    return poolId + ".page" + pageIndex + "of" + pageCount;
  }

  public static String rosterId(String poolId) {
    return poolId + ".partialRoster";
  }
}
