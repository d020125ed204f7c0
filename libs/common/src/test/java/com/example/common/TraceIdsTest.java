package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class TraceIdsTest {

  @Test
  void resolveKeepsProvidedId() {
    assertThat(TraceIds.resolve(" req-1 ")).isEqualTo("req-1");
  }

  @Test
  void resolveGeneratesIdWhenBlank() {
    final String generated = TraceIds.resolve("  ");

    assertThat(UUID.fromString(generated)).isNotNull();
    assertThat(TraceIds.resolve(null)).isNotEqualTo(generated);
  }
}
