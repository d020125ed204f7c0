/*
 * どこで: Mmlogic 設定
 * 何を: filter 評価/結果ページング/ignore list/proposal の設定を保持する
 * なぜ: 閾値やページサイズをコード外へ出し、環境ごとに調整できるようにするため
 */
package com.example.mmlogic.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "mmlogic")
public record MmlogicProperties(
    @Valid @NotNull FilterProperties filter,
    @Valid @NotNull ResultProperties results,
    @Valid @NotNull ProposalProperties proposal,
    Map<String, @Valid IgnoreListProperties> ignoreLists,
    @NotNull Duration queryTimeout) {

  public MmlogicProperties {
    ignoreLists = ignoreLists == null ? Map.of() : Map.copyOf(ignoreLists);
  }

  @AssertTrue(message = "proposal.ignore-list must name a configured ignore list")
  public boolean isProposalIgnoreListConfigured() {
    return proposal == null || ignoreLists.containsKey(proposal.ignoreList());
  }

  public record FilterProperties(
      @Min(1) int fetchPageSize,
      @Min(1) long softLimit,
      @Min(1) long hardLimit,
      @NotNull FilterEvaluation evaluation,
      @Min(1) int concurrency) {

    @AssertTrue(message = "soft-limit must be less than hard-limit")
    public boolean isSoftLimitBelowHardLimit() {
      return softLimit < hardLimit;
    }
  }

  public record ResultProperties(@Min(1) int pageSize) {}

  public record ProposalProperties(@NotBlank String ignoreList, @NotBlank String queue) {}

  /** horizon 未指定は期間無制限で読む。 */
  public record IgnoreListProperties(@NotBlank String key, Duration horizon) {}

  public enum FilterEvaluation {
    SEQUENTIAL,
    CONCURRENT
  }
}
