/*
 * どこで: Mmlogic API
 * 何を: roster ページを NDJSON の 1 行として応答ストリームへ書き出す
 * なぜ: ページ単位で flush し、呼び出し側が受信しながら処理できるようにするため
 */
package com.example.mmlogic.api;

import com.example.mmlogic.api.response.PlayerPoolPageResponse;
import com.example.mmlogic.model.RosterPage;
import com.example.mmlogic.service.RosterPageSink;
import com.example.mmlogic.service.StreamSendException;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.OutputStream;

final class NdjsonRosterPageSink implements RosterPageSink {

  private static final byte NEWLINE = '\n';

  private final ObjectMapper objectMapper;
  private final OutputStream outputStream;

  NdjsonRosterPageSink(ObjectMapper objectMapper, OutputStream outputStream) {
    this.objectMapper = objectMapper.copy().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    this.outputStream = outputStream;
  }

  @Override
  public void send(RosterPage page) {
    try {
      objectMapper.writeValue(outputStream, PlayerPoolPageResponse.from(page));
      outputStream.write(NEWLINE);
      outputStream.flush();
    } catch (IOException ex) {
      throw new StreamSendException(page.id(), ex);
    }
  }
}
