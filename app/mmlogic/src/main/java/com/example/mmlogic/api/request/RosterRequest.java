package com.example.mmlogic.api.request;

import com.example.mmlogic.model.Player;
import com.example.mmlogic.model.Roster;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.NotBlank;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はリクエスト受け取り専用であり、防御的コピーを行わないため")
public record RosterRequest(String id, List<PlayerRef> players) {

  public Roster toRoster() {
    final List<PlayerRef> safePlayers = players == null ? List.of() : players;
    return new Roster(
        id, safePlayers.stream().map(player -> Player.withoutProperties(player.id())).toList());
  }

  public record PlayerRef(@NotBlank String id) {}
}
