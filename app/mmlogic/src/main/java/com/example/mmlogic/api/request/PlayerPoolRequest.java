/*
 * どこで: Mmlogic API リクエスト DTO
 * 何を: GetPlayerPool と profile 内 pool 定義の入力を定義する
 * なぜ: filter 群をドメインモデルへ変換する入口を 1 つにするため
 */
package com.example.mmlogic.api.request;

import com.example.mmlogic.model.PlayerPool;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はリクエスト受け取り専用であり、防御的コピーを行わないため")
public record PlayerPoolRequest(@NotBlank String id, List<@Valid FilterRequest> filters) {

  /** filters 未指定は filter 0 件の pool として扱う。 */
  public PlayerPool toPlayerPool() {
    final List<FilterRequest> safeFilters = filters == null ? List.of() : filters;
    return new PlayerPool(id, safeFilters.stream().map(FilterRequest::toFilter).toList());
  }
}
