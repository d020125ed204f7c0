/*
 * どこで: Mmlogic Repository 層
 * 何を: backing store の通信/実行失敗を表現する
 * なぜ: 失敗した key とクエリを呼び出し側のエラー応答まで運ぶため
 */
package com.example.mmlogic.repository;

public class StoreException extends RuntimeException {

  private final String key;
  private final String query;

  public StoreException(String query, String key, Throwable cause) {
    super("state storage error query=" + query + " key=" + key, cause);
    this.key = key;
    this.query = query;
  }

  public String key() {
    return key;
  }

  public String query() {
    return query;
  }
}
