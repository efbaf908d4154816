package com.codeheadsystems.tessera.jdbc;

import com.codeheadsystems.tessera.exceptions.BackendUnavailableException;
import com.codeheadsystems.tessera.exceptions.SessionNotFoundException;
import com.codeheadsystems.tessera.exceptions.TokenCollisionException;
import com.codeheadsystems.tessera.model.Session;
import com.codeheadsystems.tessera.model.SessionId;
import com.codeheadsystems.tessera.store.ExpiredSessionPurger;
import com.codeheadsystems.tessera.store.SessionCodec;
import com.codeheadsystems.tessera.store.SessionStore;
import com.codeheadsystems.tessera.store.SessionStoreConfig;
import com.codeheadsystems.tessera.token.SessionIdGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SessionStore} on a relational database.
 * <p>
 * One row per session:
 * <pre>{@code
 *   id VARCHAR(64) PRIMARY KEY, payload BLOB,
 *   created_at BIGINT, last_accessed_at BIGINT, expires_at BIGINT   -- epoch milliseconds
 * }</pre>
 * Creating the table is up to the integrator; {@link #createTableSql()} gives a reference DDL.
 * Writes are guarded by {@code expires_at > now}, so an expired row behaves as if absent. Only
 * touch and sliding loads move {@code expires_at}. Expired
 * rows are only deleted by {@link #purgeExpired()}, which a scheduled job or a
 * {@link com.codeheadsystems.tessera.store.SessionReaper} should call.
 * <p>
 * Every {@link SQLException} surfaces as a {@link BackendUnavailableException}.
 */
public class JdbcSessionStore implements SessionStore, ExpiredSessionPurger {

  private static final Logger log = LoggerFactory.getLogger(JdbcSessionStore.class);

  public static final String DEFAULT_TABLE = "tessera_sessions";

  private static final String UNIQUE_VIOLATION = "23505";
  private static final String INTEGRITY_VIOLATION = "23000";

  private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

  private final DataSource dataSource;
  private final SessionStoreConfig config;
  private final SessionIdGenerator generator;
  private final Clock clock;
  private final String table;
  private final SessionCodec codec;

  private final String insertSql;
  private final String selectSql;
  private final String updateSql;
  private final String expirySql;
  private final String extendSql;
  private final String deleteSql;
  private final String purgeSql;

  /**
   * Instantiates a new Jdbc session store on the default table.
   *
   * @param dataSource the data source
   * @param config     the config
   */
  public JdbcSessionStore(DataSource dataSource, SessionStoreConfig config) {
    this(dataSource, config, new SessionIdGenerator(), Clock.systemUTC(), DEFAULT_TABLE);
  }

  /**
   * Instantiates a new Jdbc session store.
   *
   * @param dataSource the data source
   * @param config     the config
   * @param generator  id source
   * @param clock      time source
   * @param table      table name, optionally schema-qualified
   */
  public JdbcSessionStore(DataSource dataSource,
                          SessionStoreConfig config,
                          SessionIdGenerator generator,
                          Clock clock,
                          String table) {
    if (table == null || !TABLE_NAME.matcher(table).matches()) {
      throw new IllegalArgumentException("Invalid table name: " + table);
    }
    this.dataSource = dataSource;
    this.config = config;
    this.generator = generator;
    this.clock = clock;
    this.table = table;
    this.codec = new SessionCodec(config.maxPayloadSize());
    this.insertSql = "INSERT INTO " + table
        + " (id, payload, created_at, last_accessed_at, expires_at) VALUES (?, ?, ?, ?, ?)";
    this.selectSql = "SELECT payload, created_at, last_accessed_at, expires_at FROM " + table
        + " WHERE id = ? AND expires_at > ?";
    this.updateSql = "UPDATE " + table
        + " SET payload = ?, last_accessed_at = ? WHERE id = ? AND expires_at > ?";
    this.expirySql = "SELECT expires_at FROM " + table + " WHERE id = ?";
    this.extendSql = "UPDATE " + table
        + " SET last_accessed_at = ?, expires_at = ? WHERE id = ? AND expires_at > ?";
    this.deleteSql = "DELETE FROM " + table + " WHERE id = ?";
    this.purgeSql = "DELETE FROM " + table + " WHERE expires_at <= ?";
  }

  /**
   * Reference DDL for the default table.
   *
   * @return the create table statement
   */
  public static String createTableSql() {
    return createTableSql(DEFAULT_TABLE);
  }

  /**
   * Reference DDL. Column types may need adjusting for a given database (BYTEA on PostgreSQL,
   * LONGBLOB on MySQL for large payloads).
   *
   * @param table the table name
   * @return the create table statement
   */
  public static String createTableSql(String table) {
    return "CREATE TABLE " + table + " ("
        + "id VARCHAR(64) NOT NULL PRIMARY KEY, "
        + "payload BLOB NOT NULL, "
        + "created_at BIGINT NOT NULL, "
        + "last_accessed_at BIGINT NOT NULL, "
        + "expires_at BIGINT NOT NULL)";
  }

  public String table() {
    return table;
  }

  @Override
  public Session create(Map<String, JsonNode> payload, Duration ttl) {
    SessionStoreConfig.requirePositive(ttl);
    byte[] encoded = codec.encodePayload(payload);
    Instant now = clock.instant();
    Instant expiresAt = now.plus(ttl);
    for (int attempt = 1; attempt <= MAX_CREATE_ATTEMPTS; attempt++) {
      SessionId id = generator.newToken();
      try (Connection connection = dataSource.getConnection();
           PreparedStatement statement = connection.prepareStatement(insertSql)) {
        statement.setString(1, id.value());
        statement.setBinaryStream(2, new ByteArrayInputStream(encoded), encoded.length);
        statement.setLong(3, now.toEpochMilli());
        statement.setLong(4, now.toEpochMilli());
        statement.setLong(5, expiresAt.toEpochMilli());
        statement.executeUpdate();
        log.debug("Created session {}", id);
        return Session.restore(id, codec.decodePayload(encoded), now, now, expiresAt);
      } catch (SQLException e) {
        if (!isDuplicateKey(e)) {
          throw unavailable("create", e);
        }
        log.warn("Session id collision on attempt {}", attempt);
      }
    }
    throw new TokenCollisionException(MAX_CREATE_ATTEMPTS);
  }

  @Override
  public Optional<Session> load(SessionId id) {
    Instant now = clock.instant();
    try (Connection connection = dataSource.getConnection()) {
      if (!config.slidingExpiration()) {
        return select(connection, id, now);
      }
      return loadSliding(connection, id, now);
    } catch (SQLException e) {
      throw unavailable("load", e);
    }
  }

  private Optional<Session> loadSliding(Connection connection, SessionId id, Instant now)
      throws SQLException {
    boolean autoCommit = connection.getAutoCommit();
    connection.setAutoCommit(false);
    try {
      Optional<Session> result = Optional.empty();
      if (extend(connection, id, now) > 0) {
        result = select(connection, id, now);
      }
      connection.commit();
      return result;
    } catch (SQLException | RuntimeException e) {
      rollbackQuietly(connection, e);
      throw e;
    } finally {
      connection.setAutoCommit(autoCommit);
    }
  }

  /**
   * Replaces the payload of a live row. The row keeps its own {@code expires_at}, so an extension
   * made by a concurrent touch or sliding load survives the write; the in-hand copy picks up that
   * expiry.
   */
  @Override
  public void save(Session session) {
    SessionId id = session.id();
    byte[] encoded = codec.encodePayload(session.attributes());
    Instant now = clock.instant();
    Instant expiresAt;
    try (Connection connection = dataSource.getConnection()) {
      expiresAt = saveInTransaction(connection, id, encoded, now);
    } catch (SQLException e) {
      throw unavailable("save", e);
    }
    session.recordAccess(now, expiresAt);
    log.debug("Saved session {}", id);
  }

  private Instant saveInTransaction(Connection connection, SessionId id, byte[] encoded, Instant now)
      throws SQLException {
    boolean autoCommit = connection.getAutoCommit();
    connection.setAutoCommit(false);
    try {
      int updated;
      try (PreparedStatement statement = connection.prepareStatement(updateSql)) {
        statement.setBinaryStream(1, new ByteArrayInputStream(encoded), encoded.length);
        statement.setLong(2, now.toEpochMilli());
        statement.setString(3, id.value());
        statement.setLong(4, now.toEpochMilli());
        updated = statement.executeUpdate();
      }
      Optional<Instant> expiresAt = updated == 0 ? Optional.empty() : selectExpiry(connection, id);
      connection.commit();
      return expiresAt.orElseThrow(
          () -> new SessionNotFoundException("Session " + id + " no longer exists"));
    } catch (SQLException | RuntimeException e) {
      rollbackQuietly(connection, e);
      throw e;
    } finally {
      connection.setAutoCommit(autoCommit);
    }
  }

  @Override
  public void remove(SessionId id) {
    try (Connection connection = dataSource.getConnection();
         PreparedStatement statement = connection.prepareStatement(deleteSql)) {
      statement.setString(1, id.value());
      statement.executeUpdate();
      log.debug("Removed session {}", id);
    } catch (SQLException e) {
      throw unavailable("remove", e);
    }
  }

  @Override
  public void touch(SessionId id) {
    int updated;
    try (Connection connection = dataSource.getConnection()) {
      updated = extend(connection, id, clock.instant());
    } catch (SQLException e) {
      throw unavailable("touch", e);
    }
    if (updated == 0) {
      throw new SessionNotFoundException("Session " + id + " no longer exists");
    }
  }

  @Override
  public int purgeExpired() {
    try (Connection connection = dataSource.getConnection();
         PreparedStatement statement = connection.prepareStatement(purgeSql)) {
      statement.setLong(1, clock.instant().toEpochMilli());
      return statement.executeUpdate();
    } catch (SQLException e) {
      throw unavailable("purge", e);
    }
  }

  @Override
  public SessionStoreConfig config() {
    return config;
  }

  private int extend(Connection connection, SessionId id, Instant now) throws SQLException {
    try (PreparedStatement statement = connection.prepareStatement(extendSql)) {
      statement.setLong(1, now.toEpochMilli());
      statement.setLong(2, now.plus(config.ttl()).toEpochMilli());
      statement.setString(3, id.value());
      statement.setLong(4, now.toEpochMilli());
      return statement.executeUpdate();
    }
  }

  private Optional<Session> select(Connection connection, SessionId id, Instant now)
      throws SQLException {
    try (PreparedStatement statement = connection.prepareStatement(selectSql)) {
      statement.setString(1, id.value());
      statement.setLong(2, now.toEpochMilli());
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        byte[] payload = readBytes(rs);
        return Optional.of(Session.restore(id,
            codec.decodePayload(payload),
            Instant.ofEpochMilli(rs.getLong("created_at")),
            Instant.ofEpochMilli(rs.getLong("last_accessed_at")),
            Instant.ofEpochMilli(rs.getLong("expires_at"))));
      }
    }
  }

  private Optional<Instant> selectExpiry(Connection connection, SessionId id) throws SQLException {
    try (PreparedStatement statement = connection.prepareStatement(expirySql)) {
      statement.setString(1, id.value());
      try (ResultSet rs = statement.executeQuery()) {
        return rs.next() ? Optional.of(Instant.ofEpochMilli(rs.getLong("expires_at"))) : Optional.empty();
      }
    }
  }

  private static byte[] readBytes(ResultSet rs) throws SQLException {
    try (InputStream in = rs.getBinaryStream("payload")) {
      return in == null ? new byte[0] : in.readAllBytes();
    } catch (IOException e) {
      throw new SQLException("Unable to read session payload", e);
    }
  }

  /**
   * Unique and primary key violations only. Other integrity violations (NOT NULL, CHECK, foreign
   * keys) share SQLState class 23 and must not be retried as collisions.
   */
  static boolean isDuplicateKey(SQLException e) {
    String state = e.getSQLState();
    if (state == null) {
      return false;
    }
    // 23505: SQL standard, Derby, PostgreSQL, H2. 23000 + 1062: MySQL/MariaDB. 23000 + 1: Oracle.
    return UNIQUE_VIOLATION.equals(state)
        || (INTEGRITY_VIOLATION.equals(state) && (e.getErrorCode() == 1062 || e.getErrorCode() == 1));
  }

  private static void rollbackQuietly(Connection connection, Exception cause) {
    try {
      connection.rollback();
    } catch (SQLException rollbackFailure) {
      cause.addSuppressed(rollbackFailure);
    }
  }

  private BackendUnavailableException unavailable(String operation, SQLException e) {
    return new BackendUnavailableException(
        "Session " + operation + " failed on table " + table + ": " + e.getMessage(), e);
  }
}
