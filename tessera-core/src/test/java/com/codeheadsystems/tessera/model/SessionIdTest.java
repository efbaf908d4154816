package com.codeheadsystems.tessera.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class SessionIdTest {

  private static final String VALID = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJ0123-_9";

  @Test
  void parse_wellFormed_returnsId() {
    assertThat(SessionId.parse(VALID)).contains(new SessionId(VALID));
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {
      "short",
      "abcdefghijklmnopqrstuvwxyzABCDEFGHIJ0123-_9X",
      "abcdefghijklmnopqrstuvwxyzABCDEFGHIJ0123+/9",
      "abcdefghijklmnopqrstuvwxyzABCDEFGHIJ0123-_=",
      "abcdefghijklmnopqrstuvwxyzABCDEFGHIJ0123 _9"
  })
  void parse_malformed_returnsEmpty(String raw) {
    assertThat(SessionId.parse(raw)).isEmpty();
  }

  @Test
  void constructor_malformed_throws() {
    assertThatThrownBy(() -> new SessionId("nope")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void toString_doesNotLeakToken() {
    assertThat(new SessionId(VALID).toString()).doesNotContain(VALID).startsWith("SessionId[abcdef");
  }
}
