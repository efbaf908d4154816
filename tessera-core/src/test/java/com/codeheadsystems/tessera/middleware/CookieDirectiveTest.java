package com.codeheadsystems.tessera.middleware;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.tessera.model.SessionId;
import com.codeheadsystems.tessera.token.SessionIdGenerator;
import org.junit.jupiter.api.Test;

class CookieDirectiveTest {

  @Test
  void set_rendersAllAttributes() {
    SessionId id = new SessionIdGenerator().newToken();

    String header = CookieDirective.set(CookieSettings.defaults(), id, 3600).toSetCookieHeader();

    assertThat(header).isEqualTo("tessera_session=" + id.value()
        + "; Path=/; Max-Age=3600; Secure; HttpOnly; SameSite=Lax");
  }

  @Test
  void clear_hasEmptyValueAndZeroMaxAge() {
    CookieDirective directive = CookieDirective.clear(CookieSettings.defaults().withDomain("example.com"));

    assertThat(directive.isClear()).isTrue();
    assertThat(directive.toSetCookieHeader())
        .isEqualTo("tessera_session=; Path=/; Domain=example.com; Max-Age=0; Secure; HttpOnly; SameSite=Lax");
  }

  @Test
  void insecureCookie_omitsSecure() {
    CookieSettings settings = new CookieSettings("sid", "/app", null, false, false, "Strict", true);

    assertThat(CookieDirective.clear(settings).toSetCookieHeader())
        .isEqualTo("sid=; Path=/app; Max-Age=0; SameSite=Strict");
  }

  @Test
  void settings_rejectInvalidSameSite() {
    assertThatThrownBy(() -> new CookieSettings("sid", "/", null, true, true, "lax", true))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new CookieSettings("sid", "/", null, false, true, "None", true))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
