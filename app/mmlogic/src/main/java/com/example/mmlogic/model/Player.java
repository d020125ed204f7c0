/*
 * どこで: Mmlogic ドメインモデル
 * 何を: roster に載る候補 player と、一致した属性値の組を表現する
 * なぜ: MMF が filter ごとの値を再検索せずに使えるようにするため
 */
package com.example.mmlogic.model;

import java.util.List;

public record Player(String id, List<PlayerProperty> properties) {

  public Player {
    properties = properties == null ? List.of() : List.copyOf(properties);
  }

  public static Player withoutProperties(String id) {
    return new Player(id, List.of());
  }
}
