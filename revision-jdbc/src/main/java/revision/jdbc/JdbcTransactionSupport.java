package revision.jdbc;

import revision.TransactionException;
import revision.context.RevisionContextManager;
import revision.spi.TransactionSupport;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link TransactionSupport} for manual JDBC usage. Transaction state is kept
 * in a {@link ThreadLocal}, per resource alias.
 *
 * <p>The outermost block of a resource obtains a connection from the resource's
 * {@link ConnectionProvider}, disables auto-commit and binds it to the thread.
 * Nested blocks set a savepoint on that connection: committing a nested block
 * releases its savepoint, rolling it back returns to the savepoint and leaves
 * the outer transaction running. The connection is committed or rolled back and
 * closed when the outermost block completes.
 *
 * <pre>{@code
 * JdbcTransactionSupport tx = new JdbcTransactionSupport(dataSource::getConnection);
 * Revisions revisions = Revisions.builder()
 *     .transactionSupport(tx)
 *     .revisionListener(revision -> versionStore.insert(tx.currentConnection(), revision))
 *     .build();
 * }</pre>
 */
public final class JdbcTransactionSupport implements TransactionSupport {
  private final Map<String, ConnectionProvider> connectionProviders;
  private final ThreadLocal<Map<String, TxState>> state = new ThreadLocal<>();

  /**
   * Creates transaction support for the {@code "default"} resource only.
   */
  public JdbcTransactionSupport(ConnectionProvider connectionProvider) {
    this(Map.of(RevisionContextManager.DEFAULT_RESOURCE,
        Objects.requireNonNull(connectionProvider, "connectionProvider")));
  }

  /**
   * Creates transaction support for several resources.
   *
   * @param connectionProviders connection provider per resource alias
   */
  public JdbcTransactionSupport(Map<String, ConnectionProvider> connectionProviders) {
    Objects.requireNonNull(connectionProviders, "connectionProviders");
    if (connectionProviders.isEmpty()) {
      throw new IllegalArgumentException("At least one connection provider is required");
    }
    this.connectionProviders = Map.copyOf(new LinkedHashMap<>(connectionProviders));
  }

  /**
   * Returns {@code true} if a transaction on {@code resource} is active on this thread.
   */
  public boolean isTransactionActive(String resource) {
    return current(resource) != null;
  }

  /**
   * Returns the connection bound to the default resource's transaction.
   *
   * @throws IllegalStateException if no transaction is active
   */
  public Connection currentConnection() {
    return currentConnection(RevisionContextManager.DEFAULT_RESOURCE);
  }

  /**
   * Returns the connection bound to the transaction on {@code resource}.
   *
   * @throws IllegalStateException if no transaction is active
   */
  public Connection currentConnection(String resource) {
    return require(resource).connection;
  }

  /**
   * Returns how many blocks are open on {@code resource} on this thread.
   */
  public int depth(String resource) {
    TxState current = current(resource);
    return current == null ? 0 : current.depth;
  }

  /**
   * Registers a callback to run after the outermost transaction on
   * {@code resource} commits.
   *
   * @throws IllegalStateException if no transaction is active
   */
  public void afterCommit(String resource, Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    require(resource).afterCommit.add(callback);
  }

  /**
   * Registers a callback to run after the outermost transaction on
   * {@code resource} rolls back.
   *
   * @throws IllegalStateException if no transaction is active
   */
  public void afterRollback(String resource, Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    require(resource).afterRollback.add(callback);
  }

  @Override
  public AtomicBlock begin(String resource) {
    Objects.requireNonNull(resource, "resource");
    ConnectionProvider provider = connectionProviders.get(resource);
    if (provider == null) {
      throw new IllegalArgumentException("No connection provider for resource '" + resource + "'");
    }
    TxState current = current(resource);
    if (current != null) {
      try {
        Savepoint savepoint = current.connection.setSavepoint();
        current.depth++;
        return new SavepointBlock(current, savepoint);
      } catch (SQLException e) {
        throw new TransactionException("Failed to set savepoint on resource '" + resource + "'", e);
      }
    }
    Connection connection;
    try {
      connection = provider.getConnection();
    } catch (SQLException e) {
      throw new TransactionException("Failed to obtain connection for resource '" + resource + "'", e);
    }
    try {
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      closeQuietly(connection, e);
      throw new TransactionException("Failed to begin transaction on resource '" + resource + "'", e);
    }
    TxState bound = new TxState(resource, connection);
    Map<String, TxState> states = state.get();
    if (states == null) {
      states = new HashMap<>();
      state.set(states);
    }
    states.put(resource, bound);
    return new TransactionBlock(bound);
  }

  private TxState current(String resource) {
    Map<String, TxState> states = state.get();
    return states == null ? null : states.get(resource);
  }

  private TxState require(String resource) {
    TxState current = current(resource);
    if (current == null) {
      throw new IllegalStateException("No active transaction");
    }
    return current;
  }

  private void unbind(TxState tx) {
    Map<String, TxState> states = state.get();
    if (states == null) {
      return;
    }
    states.remove(tx.resource);
    if (states.isEmpty()) {
      state.remove();
    }
  }

  private static void closeQuietly(Connection connection, Exception primary) {
    try {
      connection.close();
    } catch (SQLException e) {
      primary.addSuppressed(e);
    }
  }

  /**
   * Outermost block of a resource: a real transaction.
   */
  private final class TransactionBlock implements AtomicBlock {
    private final TxState tx;
    private boolean completed;

    private TransactionBlock(TxState tx) {
      this.tx = tx;
    }

    @Override
    public void commit() {
      if (completed) {
        return;
      }
      boolean committed = false;
      try {
        tx.connection.commit();
        committed = true;
      } catch (SQLException e) {
        safeRollback(e);
        throw new TransactionException("Commit failed on resource '" + tx.resource + "'", e);
      } finally {
        finalizeTx(committed);
      }
    }

    @Override
    public void rollback() {
      if (completed) {
        return;
      }
      try {
        tx.connection.rollback();
      } catch (SQLException e) {
        throw new TransactionException("Rollback failed on resource '" + tx.resource + "'", e);
      } finally {
        finalizeTx(false);
      }
    }

    private void finalizeTx(boolean committed) {
      completed = true;
      unbind(tx);
      RuntimeException callbackException = null;
      try {
        runCallbacks(committed ? tx.afterCommit : tx.afterRollback);
      } catch (RuntimeException e) {
        callbackException = e;
      } finally {
        try {
          tx.connection.setAutoCommit(true);
        } catch (SQLException e) {
          if (callbackException != null) callbackException.addSuppressed(e);
        } finally {
          try {
            tx.connection.close();
          } catch (SQLException e) {
            if (callbackException != null) callbackException.addSuppressed(e);
          }
        }
      }
      if (callbackException != null) {
        throw callbackException;
      }
    }

    private void safeRollback(SQLException primary) {
      try {
        tx.connection.rollback();
      } catch (SQLException e) {
        primary.addSuppressed(e);
      }
    }

    private void runCallbacks(List<Runnable> callbacks) {
      RuntimeException first = null;
      for (Runnable callback : callbacks) {
        try {
          callback.run();
        } catch (RuntimeException e) {
          if (first == null) first = e;
          else first.addSuppressed(e);
        }
      }
      if (first != null) throw first;
    }
  }

  /**
   * Nested block: a savepoint on the outer transaction's connection.
   */
  private static final class SavepointBlock implements AtomicBlock {
    private final TxState tx;
    private final Savepoint savepoint;
    private boolean completed;

    private SavepointBlock(TxState tx, Savepoint savepoint) {
      this.tx = tx;
      this.savepoint = savepoint;
    }

    @Override
    public void commit() {
      if (completed) {
        return;
      }
      completed = true;
      tx.depth--;
      try {
        tx.connection.releaseSavepoint(savepoint);
      } catch (SQLException e) {
        throw new TransactionException("Failed to release savepoint on resource '" + tx.resource + "'", e);
      }
    }

    @Override
    public void rollback() {
      if (completed) {
        return;
      }
      completed = true;
      tx.depth--;
      try {
        tx.connection.rollback(savepoint);
      } catch (SQLException e) {
        throw new TransactionException("Failed to roll back to savepoint on resource '" + tx.resource + "'", e);
      }
    }
  }

  private static final class TxState {
    private final String resource;
    private final Connection connection;
    private final List<Runnable> afterCommit = new ArrayList<>();
    private final List<Runnable> afterRollback = new ArrayList<>();
    private int depth = 1;

    private TxState(String resource, Connection connection) {
      this.resource = resource;
      this.connection = connection;
    }
  }
}
