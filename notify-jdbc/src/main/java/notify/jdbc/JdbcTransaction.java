package notify.jdbc;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A connection with auto-commit disabled, for store operations that write more than one
 * row. If {@link #commit()} is not called, {@link #close()} rolls back.
 *
 * <pre>{@code
 * try (JdbcTransaction tx = JdbcTransaction.begin(connectionProvider)) {
 *   JdbcTemplate.update(tx.connection(), sql, params);
 *   tx.commit();
 * }
 * }</pre>
 */
public final class JdbcTransaction implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(JdbcTransaction.class.getName());

  private final Connection connection;
  private boolean completed;

  private JdbcTransaction(Connection connection) {
    this.connection = connection;
  }

  /**
   * Obtains a connection and disables auto-commit on it.
   *
   * @param connectionProvider source of the connection
   * @return the open transaction
   * @throws NotifyStoreException if no connection can be obtained
   */
  public static JdbcTransaction begin(ConnectionProvider connectionProvider) {
    Objects.requireNonNull(connectionProvider, "connectionProvider");
    Connection connection;
    try {
      connection = connectionProvider.getConnection();
    } catch (SQLException e) {
      throw new NotifyStoreException("Failed to obtain connection", e);
    }
    try {
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      closeQuietly(connection, e);
      throw new NotifyStoreException("Failed to begin transaction", e);
    }
    return new JdbcTransaction(connection);
  }

  public Connection connection() {
    return connection;
  }

  public void commit() {
    if (completed) {
      return;
    }
    try {
      connection.commit();
    } catch (SQLException e) {
      rollbackAfter(e);
      throw new NotifyStoreException("Failed to commit transaction", e);
    } finally {
      finish();
    }
  }

  @Override
  public void close() {
    if (completed) {
      return;
    }
    try {
      connection.rollback();
    } catch (SQLException e) {
      throw new NotifyStoreException("Failed to roll back transaction", e);
    } finally {
      finish();
    }
  }

  private void rollbackAfter(SQLException cause) {
    try {
      connection.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  private void finish() {
    completed = true;
    try {
      connection.setAutoCommit(true);
    } catch (SQLException e) {
      logger.log(Level.FINE, "Failed to restore auto-commit before close", e);
    } finally {
      closeQuietly(connection, null);
    }
  }

  private static void closeQuietly(Connection connection, SQLException primary) {
    try {
      connection.close();
    } catch (SQLException e) {
      if (primary != null) {
        primary.addSuppressed(e);
      } else {
        throw new NotifyStoreException("Failed to close connection", e);
      }
    }
  }
}
