/*
 * どこで: Mmlogic API レスポンス DTO
 * 何を: roster stream の 1 ページ (NDJSON の 1 行) を定義する
 * なぜ: 呼び出し側がページを連結して pool 全体を再構成できる形を固定するため
 */
package com.example.mmlogic.api.response;

import com.example.mmlogic.model.RosterPage;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "API DTO record はレスポンス整形用途のため")
public record PlayerPoolPageResponse(
    String id,
    int page,
    int pageCount,
    List<FilterResponse> filters,
    StatsResponse stats,
    List<RosterResponse> roster) {

  public static PlayerPoolPageResponse from(RosterPage page) {
    return new PlayerPoolPageResponse(
        page.id(),
        page.pageIndex(),
        page.pageCount(),
        page.filters().stream().map(FilterResponse::from).toList(),
        StatsResponse.from(page.stats()),
        List.of(RosterResponse.from(page.roster())));
  }
}
