package revision.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for the outermost transaction of a resource.
 *
 * <p>{@link JdbcTransactionSupport} closes the connections it obtains. A
 * {@code DataSource} is adapted with {@code dataSource::getConnection}.
 */
@FunctionalInterface
public interface ConnectionProvider {

  /**
   * Obtains a new JDBC connection.
   *
   * @return an open connection
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;
}
