/*
 * どこで: Mmlogic API リクエスト DTO
 * 何を: player pool の 1 filter の入力を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.example.mmlogic.api.request;

import com.example.mmlogic.model.Filter;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FilterRequest(String id, String name, @NotBlank String field, long minv, Long maxv) {

  public Filter toFilter() {
    return new Filter(id, name, field, minv, maxv);
  }
}
