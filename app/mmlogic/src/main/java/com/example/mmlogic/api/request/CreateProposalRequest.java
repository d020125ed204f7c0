/*
 * どこで: Mmlogic API リクエスト DTO
 * 何を: CreateProposal の入力 (match object) を定義する
 * なぜ: roster の player を ignore list へ載せるために必要な形を固定するため
 */
package com.example.mmlogic.api.request;

import com.example.mmlogic.model.MatchObject;
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
public record CreateProposalRequest(
    @NotBlank String id, String properties, List<@Valid RosterRequest> rosters) {

  public MatchObject toMatchObject() {
    final List<RosterRequest> safeRosters = rosters == null ? List.of() : rosters;
    return new MatchObject(id, properties, safeRosters.stream().map(RosterRequest::toRoster).toList());
  }
}
