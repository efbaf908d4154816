package com.codeheadsystems.tessera.springboot.filter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.when;

import com.codeheadsystems.tessera.exceptions.BackendUnavailableException;
import com.codeheadsystems.tessera.middleware.SessionContext;
import com.codeheadsystems.tessera.middleware.SessionManager;
import com.codeheadsystems.tessera.middleware.SessionManagerConfig;
import com.codeheadsystems.tessera.store.InMemorySessionStore;
import com.codeheadsystems.tessera.store.SessionStore;
import com.codeheadsystems.tessera.store.SessionStoreConfig;
import com.codeheadsystems.tessera.token.SessionIdGenerator;
import jakarta.servlet.FilterChain;
import jakarta.servlet.http.Cookie;
import java.time.Clock;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@ExtendWith(MockitoExtension.class)
class SessionFilterTest {

  @Mock private SessionStore failingStore;

  private InMemorySessionStore store;
  private SessionFilter filter;
  private MockHttpServletRequest request;
  private MockHttpServletResponse response;

  @BeforeEach
  void setUp() {
    store = new InMemorySessionStore(SessionStoreConfig.defaults(), new SessionIdGenerator(),
        Clock.systemUTC(), 1, null);
    filter = new SessionFilter(new SessionManager(store, SessionManagerConfig.defaults()));
    request = new MockHttpServletRequest("GET", "/");
    response = new MockHttpServletResponse();
  }

  @AfterEach
  void tearDown() {
    store.shutdown();
  }

  @Test
  void newSession_setsCookieAndKeepsBody() throws Exception {
    FilterChain chain = (req, res) -> {
      context(req).getOrCreate().put("user", "alice");
      res.getWriter().write("hello");
    };

    filter.doFilter(request, response, chain);

    assertThat(response.getHeader("Set-Cookie")).startsWith("tessera_session=").contains("Secure");
    assertThat(response.getContentAsString()).isEqualTo("hello");
    assertThat(store.size()).isEqualTo(1);
  }

  @Test
  void existingCookie_exposesLoadedSession() throws Exception {
    String id = store.create(Map.of()).id().value();
    request.setCookies(new Cookie("tessera_session", id));
    FilterChain chain = (req, res) -> assertThat(context(req).session()).isPresent();

    filter.doFilter(request, response, chain);

    assertThat(response.getHeader("Set-Cookie")).isNull();
  }

  @Test
  void handlerThrows_nothingCommitted() {
    FilterChain chain = (req, res) -> {
      context(req).getOrCreate().put("user", "alice");
      throw new IllegalStateException("boom");
    };

    assertThatThrownBy(() -> filter.doFilter(request, response, chain)).isInstanceOf(IllegalStateException.class);
    assertThat(store.size()).isZero();
    assertThat(response.getHeader("Set-Cookie")).isNull();
  }

  @Test
  void serverErrorStatus_nothingCommitted() throws Exception {
    FilterChain chain = (req, res) -> {
      context(req).getOrCreate().put("user", "alice");
      ((jakarta.servlet.http.HttpServletResponse) res).setStatus(502);
    };

    filter.doFilter(request, response, chain);

    assertThat(store.size()).isZero();
    assertThat(response.getStatus()).isEqualTo(502);
  }

  @Test
  void storeDownWhileOpening_returns503() throws Exception {
    when(failingStore.load(any())).thenThrow(new BackendUnavailableException("down", new RuntimeException()));
    SessionFilter failing = new SessionFilter(new SessionManager(failingStore, SessionManagerConfig.defaults()));
    request.setCookies(new Cookie("tessera_session", new SessionIdGenerator().newToken().value()));
    FilterChain chain = (req, res) -> {
      throw new AssertionError("handler must not run");
    };

    failing.doFilter(request, response, chain);

    assertThat(response.getStatus()).isEqualTo(503);
  }

  @Test
  void storeDownWhileCommitting_returns503() throws Exception {
    when(failingStore.create(anyMap())).thenThrow(new BackendUnavailableException("down", new RuntimeException()));
    SessionFilter failing = new SessionFilter(new SessionManager(failingStore, SessionManagerConfig.defaults()));
    FilterChain chain = (req, res) -> {
      context(req).getOrCreate().put("user", "alice");
      res.getWriter().write("should not be sent");
    };

    failing.doFilter(request, response, chain);

    assertThat(response.getStatus()).isEqualTo(503);
    assertThat(response.getContentAsString()).doesNotContain("should not be sent");
    assertThat(response.getHeader("Set-Cookie")).isNull();
  }

  private static SessionContext context(jakarta.servlet.ServletRequest request) {
    return (SessionContext) request.getAttribute(SessionContext.ATTRIBUTE);
  }
}
