package com.codeheadsystems.tessera.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.codeheadsystems.tessera.exceptions.TokenCollisionException;
import com.codeheadsystems.tessera.model.Session;
import com.codeheadsystems.tessera.model.SessionId;
import com.codeheadsystems.tessera.token.SessionIdGenerator;
import com.fasterxml.jackson.databind.node.TextNode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * The type In memory session store test. The shared store contract is covered in tessera-testing.
 */
class InMemorySessionStoreTest {

  private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
  private static final Duration TTL = Duration.ofMinutes(10);

  private Instant now;
  private Clock clock;
  private InMemorySessionStore store;

  @BeforeEach
  void setUp() {
    now = START;
    clock = mock(Clock.class);
    when(clock.instant()).thenAnswer(inv -> now);
    store = new InMemorySessionStore(SessionStoreConfig.defaults().withTtl(TTL),
        new SessionIdGenerator(), clock, 4, null);
  }

  @AfterEach
  void tearDown() {
    store.shutdown();
  }

  @Test
  void purgeExpired_removesOnlyExpiredEntries() {
    store.create(Map.of(), Duration.ofMinutes(1));
    store.create(Map.of(), Duration.ofMinutes(1));
    Session survivor = store.create(Map.of("k", TextNode.valueOf("v")), Duration.ofMinutes(5));
    now = START.plus(Duration.ofMinutes(2));

    assertThat(store.size()).isEqualTo(3);
    assertThat(store.purgeExpired()).isEqualTo(2);
    assertThat(store.size()).isEqualTo(1);
    assertThat(store.load(survivor.id())).isPresent();
  }

  @Test
  void load_expired_evictsLazily() {
    Session session = store.create(Map.of(), TTL);
    now = START.plus(TTL);

    assertThat(store.load(session.id())).isEmpty();
    assertThat(store.size()).isZero();
  }

  @Test
  void create_collision_retriesWithFreshId() {
    SessionId taken = new SessionIdGenerator().newToken();
    SessionId fresh = new SessionIdGenerator().newToken();
    SessionIdGenerator generator = mock(SessionIdGenerator.class);
    when(generator.newToken()).thenReturn(taken, taken, fresh);
    InMemorySessionStore colliding = new InMemorySessionStore(SessionStoreConfig.defaults(),
        generator, clock, 1, null);

    assertThat(colliding.create(Map.of(), TTL).id()).isEqualTo(taken);
    assertThat(colliding.create(Map.of(), TTL).id()).isEqualTo(fresh);
  }

  @Test
  void create_collisionsExhausted_throws() {
    SessionId taken = new SessionIdGenerator().newToken();
    SessionIdGenerator generator = mock(SessionIdGenerator.class);
    when(generator.newToken()).thenReturn(taken);
    InMemorySessionStore colliding = new InMemorySessionStore(SessionStoreConfig.defaults(),
        generator, clock, 1, null);
    colliding.create(Map.of(), TTL);

    assertThatThrownBy(() -> colliding.create(Map.of(), TTL))
        .isInstanceOf(TokenCollisionException.class);
  }

  @Test
  void create_expiredIdMayBeReused() {
    SessionId id = new SessionIdGenerator().newToken();
    SessionIdGenerator generator = mock(SessionIdGenerator.class);
    when(generator.newToken()).thenReturn(id);
    InMemorySessionStore reusing = new InMemorySessionStore(SessionStoreConfig.defaults(),
        generator, clock, 1, null);
    reusing.create(Map.of("old", TextNode.valueOf("x")), TTL);
    now = START.plus(TTL);

    Session created = reusing.create(Map.of(), TTL);

    assertThat(created.id()).isEqualTo(id);
    assertThat(reusing.load(id).orElseThrow().attributes()).isEmpty();
  }

  @Test
  void constructor_zeroPartitions_throws() {
    assertThatThrownBy(() -> new InMemorySessionStore(SessionStoreConfig.defaults(),
        new SessionIdGenerator(), clock, 0, null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void defaultConstructor_usesDefaults() {
    InMemorySessionStore defaults = new InMemorySessionStore();
    try {
      assertThat(defaults.config()).isEqualTo(SessionStoreConfig.defaults());
    } finally {
      defaults.shutdown();
    }
  }
}
