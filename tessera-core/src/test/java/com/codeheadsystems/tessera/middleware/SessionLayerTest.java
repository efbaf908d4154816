package com.codeheadsystems.tessera.middleware;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.tessera.model.Session;
import com.codeheadsystems.tessera.model.SessionId;
import com.codeheadsystems.tessera.store.InMemorySessionStore;
import com.codeheadsystems.tessera.store.SessionStoreConfig;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Request to response through the middleware with the in-memory store.
 */
class SessionLayerTest {

  private InMemorySessionStore store;
  private SessionLayer<FakeRequest, FakeResponse> layer;

  @BeforeEach
  void setUp() {
    store = new InMemorySessionStore(SessionStoreConfig.defaults());
    layer = new SessionLayer<>(new SessionManager(store, SessionManagerConfig.defaults()),
        new FakeCookieAdapter());
  }

  @AfterEach
  void tearDown() {
    store.shutdown();
  }

  @Test
  void noCookie_handlerSeesNoSession_noDirective() {
    List<Optional<Session>> seen = new ArrayList<>();
    RequestHandler<FakeRequest, FakeResponse> handler = layer.wrap((request, context) -> {
      seen.add(context.session());
      return new FakeResponse("ok");
    });

    FakeResponse response = handler.handle(new FakeRequest(null));

    assertThat(seen).containsExactly(Optional.empty());
    assertThat(response.setCookies()).isEmpty();
  }

  @Test
  void validCookie_handlerSeesPayload() {
    Session session = store.create(Map.of("user", TextNode.valueOf("alice")));
    RequestHandler<FakeRequest, FakeResponse> handler = layer.wrap((request, context) ->
        new FakeResponse(context.session().flatMap(s -> s.get("user", String.class)).orElse("anon")));

    FakeResponse response = handler.handle(new FakeRequest(session.id().value()));

    assertThat(response.body()).isEqualTo("alice");
    assertThat(response.setCookies()).isEmpty();
  }

  @Test
  void newSession_setsCookieThatResolvesOnNextRequest() {
    RequestHandler<FakeRequest, FakeResponse> login = layer.wrap((request, context) -> {
      context.getOrCreate().put("user", "bob");
      return new FakeResponse("logged in");
    });
    RequestHandler<FakeRequest, FakeResponse> whoami = layer.wrap((request, context) ->
        new FakeResponse(context.session().flatMap(s -> s.get("user", String.class)).orElse("anon")));

    FakeResponse first = login.handle(new FakeRequest(null));
    String cookie = cookieValue(first.setCookies().get(0));

    assertThat(first.setCookies().get(0)).startsWith("tessera_session=").contains("HttpOnly");
    assertThat(whoami.handle(new FakeRequest(cookie)).body()).isEqualTo("bob");
  }

  @Test
  void invalidate_clearsCookieAndRemovesSession() {
    Session session = store.create(Map.of("user", TextNode.valueOf("alice")));
    RequestHandler<FakeRequest, FakeResponse> logout = layer.wrap((request, context) -> {
      context.invalidate();
      return new FakeResponse("bye");
    });

    FakeResponse response = logout.handle(new FakeRequest(session.id().value()));

    assertThat(response.setCookies()).singleElement().asString().contains("Max-Age=0");
    assertThat(store.load(session.id())).isEmpty();
  }

  @Test
  void handlerFailure_leavesStoreUntouched() {
    Session session = store.create(Map.of("user", TextNode.valueOf("alice")));
    RequestHandler<FakeRequest, FakeResponse> failing = layer.wrap((request, context) -> {
      context.session().orElseThrow().put("user", "mallory");
      context.invalidate();
      throw new IllegalStateException("boom");
    });

    assertThatThrownBy(() -> failing.handle(new FakeRequest(session.id().value())))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("boom");
    assertThat(store.load(session.id()).orElseThrow().get("user", String.class)).contains("alice");
  }

  @Test
  void rotation_changesIdKeepsPayload() {
    Session session = store.create(Map.of("user", TextNode.valueOf("alice")));
    RequestHandler<FakeRequest, FakeResponse> rotate = layer.wrap((request, context) -> {
      context.rotateId();
      return new FakeResponse("rotated");
    });

    FakeResponse response = rotate.handle(new FakeRequest(session.id().value()));
    SessionId newId = new SessionId(cookieValue(response.setCookies().get(0)));

    assertThat(newId).isNotEqualTo(session.id());
    assertThat(store.load(session.id())).isEmpty();
    assertThat(store.load(newId).orElseThrow().get("user", String.class)).contains("alice");
  }

  private static String cookieValue(String setCookie) {
    return setCookie.substring(setCookie.indexOf('=') + 1, setCookie.indexOf(';'));
  }

  record FakeRequest(String cookie) {
  }

  record FakeResponse(String body, List<String> setCookies) {
    FakeResponse(String body) {
      this(body, List.of());
    }
  }

  static class FakeCookieAdapter implements CookieAdapter<FakeRequest, FakeResponse> {

    @Override
    public Optional<String> readCookie(FakeRequest request, String name) {
      return Optional.ofNullable(request.cookie());
    }

    @Override
    public FakeResponse applyDirective(FakeResponse response, CookieDirective directive) {
      List<String> cookies = new ArrayList<>(response.setCookies());
      cookies.add(directive.toSetCookieHeader());
      return new FakeResponse(response.body(), cookies);
    }
  }
}
