package com.example.mmlogic.model;

import java.util.List;

public record Roster(String id, List<Player> players) {

  public Roster {
    players = players == null ? List.of() : List.copyOf(players);
  }

  public List<String> playerIds() {
    return players.stream().map(Player::id).toList();
  }
}
