package com.codeheadsystems.tessera.jdbc;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.atomic.AtomicInteger;
import javax.sql.DataSource;
import org.apache.derby.jdbc.EmbeddedDataSource;

/**
 * Fresh in-memory Derby databases with the session table created.
 */
final class DerbyDataSources {

  private static final AtomicInteger COUNTER = new AtomicInteger();

  private DerbyDataSources() {
  }

  static EmbeddedDataSource newDatabase() {
    EmbeddedDataSource dataSource = new EmbeddedDataSource();
    dataSource.setDatabaseName("memory:tessera" + COUNTER.incrementAndGet());
    dataSource.setCreateDatabase("create");
    return dataSource;
  }

  static EmbeddedDataSource newDatabaseWithTable() {
    EmbeddedDataSource dataSource = newDatabase();
    execute(dataSource, JdbcSessionStore.createTableSql());
    return dataSource;
  }

  static void execute(DataSource dataSource, String sql) {
    try (Connection connection = dataSource.getConnection();
         Statement statement = connection.createStatement()) {
      statement.execute(sql);
    } catch (SQLException e) {
      throw new IllegalStateException("Unable to execute " + sql, e);
    }
  }

  static void drop(EmbeddedDataSource dataSource) {
    EmbeddedDataSource dropper = new EmbeddedDataSource();
    dropper.setDatabaseName(dataSource.getDatabaseName());
    dropper.setConnectionAttributes("drop=true");
    try (Connection ignored = dropper.getConnection()) {
      throw new IllegalStateException("Derby did not drop " + dataSource.getDatabaseName());
    } catch (SQLException e) {
      // Derby reports a successful drop as SQLState 08006.
      if (!"08006".equals(e.getSQLState())) {
        throw new IllegalStateException("Unable to drop " + dataSource.getDatabaseName(), e);
      }
    }
  }
}
