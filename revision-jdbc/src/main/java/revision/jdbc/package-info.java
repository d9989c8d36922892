/**
 * JDBC transactions for revision scopes.
 *
 * <p>{@link revision.jdbc.JdbcTransactionSupport} binds one connection per thread and
 * resource alias for the outermost revision block and maps nested blocks to savepoints.
 * Revision listeners reach the bound connection through
 * {@link revision.jdbc.JdbcTransactionSupport#currentConnection(String)} to store
 * revisions atomically with the captured changes.
 */
package revision.jdbc;
