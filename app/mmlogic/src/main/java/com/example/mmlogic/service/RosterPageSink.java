package com.example.mmlogic.service;

import com.example.mmlogic.model.RosterPage;

/** roster ページの送信先。送信失敗は StreamSendException で通知する。 */
@FunctionalInterface
public interface RosterPageSink {

  void send(RosterPage page);
}
