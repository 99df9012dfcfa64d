package notify.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Source of JDBC connections for the notification and preference stores.
 *
 * <p>Every store operation borrows one connection and closes it before returning.
 */
@FunctionalInterface
public interface ConnectionProvider {

  Connection getConnection() throws SQLException;

  /**
   * Borrows connections from a pool or driver-backed {@link DataSource}.
   *
   * @param dataSource the data source
   * @return a provider delegating to {@link DataSource#getConnection()}
   */
  static ConnectionProvider of(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    return dataSource::getConnection;
  }
}
