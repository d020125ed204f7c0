/*
 * どこで: Mmlogic API
 * 何を: store 上の profile が解釈できないことを表現する
 * なぜ: 壊れた pool 定義を部分的に返さず 500 として扱うため
 */
package com.example.mmlogic.api;

public class InvalidProfileException extends RuntimeException {
  public InvalidProfileException(String profileId, Throwable cause) {
    super("profile has invalid player pools: " + profileId, cause);
  }
}
