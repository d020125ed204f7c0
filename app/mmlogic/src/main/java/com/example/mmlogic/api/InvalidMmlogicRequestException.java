/*
 * どこで: Mmlogic API
 * 何を: リクエスト妥当性エラーを表現する
 * なぜ: バリデーション失敗を 400 へ正規化するため
 */
package com.example.mmlogic.api;

public class InvalidMmlogicRequestException extends RuntimeException {
  public InvalidMmlogicRequestException(String message) {
    super(message);
  }
}
