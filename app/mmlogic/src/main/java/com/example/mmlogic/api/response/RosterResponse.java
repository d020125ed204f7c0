/*
 * どこで: Mmlogic API レスポンス DTO
 * 何を: roster と player/一致属性の応答形を定義する
 * なぜ: pool ページと ignore list 一覧で同じ roster 形を返すため
 */
package com.example.mmlogic.api.response;

import com.example.mmlogic.model.Player;
import com.example.mmlogic.model.PlayerProperty;
import com.example.mmlogic.model.Roster;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Collection;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "API DTO record はレスポンス整形用途のため")
public record RosterResponse(String id, List<PlayerResponse> players) {

  public static RosterResponse from(Roster roster) {
    return new RosterResponse(
        roster.id(), roster.players().stream().map(PlayerResponse::from).toList());
  }

  public static RosterResponse ofPlayerIds(Collection<String> playerIds) {
    return new RosterResponse(
        null, playerIds.stream().map(id -> new PlayerResponse(id, List.of())).toList());
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "API DTO record はレスポンス整形用途のため")
  public record PlayerResponse(String id, List<PropertyResponse> properties) {

    static PlayerResponse from(Player player) {
      return new PlayerResponse(
          player.id(), player.properties().stream().map(PropertyResponse::from).toList());
    }
  }

  public record PropertyResponse(String name, long value) {

    static PropertyResponse from(PlayerProperty property) {
      return new PropertyResponse(property.name(), property.value());
    }
  }
}
