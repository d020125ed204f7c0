/*
 * どこで: Mmlogic サービス層
 * 何を: roster ページ送信の失敗を表現する
 * なぜ: 送信失敗で残りページを打ち切り、呼び出し側へ transport エラーを返すため
 */
package com.example.mmlogic.service;

public class StreamSendException extends RuntimeException {

  private final String pageId;

  public StreamSendException(String pageId, Throwable cause) {
    super("failed to send roster page: " + pageId, cause);
    this.pageId = pageId;
  }

  public String pageId() {
    return pageId;
  }
}
