package revision.spring;

import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import revision.context.RevisionContextManager;
import revision.spi.TransactionSupport;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link TransactionSupport} implementation that runs revision blocks in
 * Spring-managed transactions.
 *
 * <p>Each block begins a transaction with {@link TransactionDefinition#PROPAGATION_NESTED}
 * on the resource's {@link PlatformTransactionManager}: the outermost block starts
 * a transaction (or joins one already opened by {@code @Transactional} code), nested
 * blocks become savepoints. Spring exceptions are rethrown as
 * {@link revision.TransactionException}.
 *
 * <pre>{@code
 * SpringTransactionSupport tx = new SpringTransactionSupport(new DataSourceTransactionManager(dataSource));
 * Revisions revisions = Revisions.builder().transactionSupport(tx).build();
 * }</pre>
 *
 * @see TransactionSupport
 */
public final class SpringTransactionSupport implements TransactionSupport {
  private final Map<String, PlatformTransactionManager> transactionManagers;
  private final TransactionDefinition definition;

  /**
   * Creates transaction support for the {@code "default"} resource only.
   */
  public SpringTransactionSupport(PlatformTransactionManager transactionManager) {
    this(Map.of(RevisionContextManager.DEFAULT_RESOURCE,
        Objects.requireNonNull(transactionManager, "transactionManager")));
  }

  /**
   * Creates transaction support for several resources.
   *
   * @param transactionManagers transaction manager per resource alias
   */
  public SpringTransactionSupport(Map<String, PlatformTransactionManager> transactionManagers) {
    Objects.requireNonNull(transactionManagers, "transactionManagers");
    if (transactionManagers.isEmpty()) {
      throw new IllegalArgumentException("At least one transaction manager is required");
    }
    this.transactionManagers = Map.copyOf(new LinkedHashMap<>(transactionManagers));
    DefaultTransactionDefinition nested = new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_NESTED);
    nested.setName("revision");
    this.definition = nested;
  }

  @Override
  public AtomicBlock begin(String resource) {
    Objects.requireNonNull(resource, "resource");
    PlatformTransactionManager transactionManager = transactionManagers.get(resource);
    if (transactionManager == null) {
      throw new IllegalArgumentException("No transaction manager for resource '" + resource + "'");
    }
    TransactionStatus status;
    try {
      status = transactionManager.getTransaction(definition);
    } catch (TransactionException e) {
      throw new revision.TransactionException("Failed to begin transaction on resource '" + resource + "'", e);
    }
    return new SpringBlock(resource, transactionManager, status);
  }

  /**
   * Returns whether a Spring transaction is active on the calling thread.
   */
  public boolean isTransactionActive() {
    return TransactionSynchronizationManager.isActualTransactionActive();
  }

  /**
   * Returns the connection bound to the current Spring transaction, so that a
   * revision listener can store the revision in the same transaction.
   *
   * @throws IllegalStateException if no transaction is active
   */
  public Connection currentConnection(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    if (!isTransactionActive()) {
      throw new IllegalStateException("No active transaction");
    }
    return DataSourceUtils.getConnection(dataSource);
  }

  /**
   * Registers a callback to run after the current Spring transaction commits.
   *
   * @throws IllegalStateException if no synchronized transaction is active
   */
  public void afterCommit(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    requireSynchronizationActive("afterCommit");
    TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
      @Override
      public void afterCommit() {
        callback.run();
      }
    });
  }

  /**
   * Registers a callback to run after the current Spring transaction rolls back.
   *
   * @throws IllegalStateException if no synchronized transaction is active
   */
  public void afterRollback(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    requireSynchronizationActive("afterRollback");
    TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
      @Override
      public void afterCompletion(int status) {
        if (status == STATUS_ROLLED_BACK) {
          callback.run();
        }
      }
    });
  }

  private void requireSynchronizationActive(String operation) {
    if (!isTransactionActive()) {
      throw new IllegalStateException("No active transaction");
    }
    if (!TransactionSynchronizationManager.isSynchronizationActive()) {
      throw new IllegalStateException(
          "Transaction synchronization is not active; cannot register " + operation + " callback");
    }
  }

  private static final class SpringBlock implements AtomicBlock {
    private final String resource;
    private final PlatformTransactionManager transactionManager;
    private final TransactionStatus status;

    private SpringBlock(String resource, PlatformTransactionManager transactionManager, TransactionStatus status) {
      this.resource = resource;
      this.transactionManager = transactionManager;
      this.status = status;
    }

    @Override
    public void commit() {
      if (status.isCompleted()) {
        return;
      }
      try {
        transactionManager.commit(status);
      } catch (TransactionException e) {
        throw new revision.TransactionException("Commit failed on resource '" + resource + "'", e);
      }
    }

    @Override
    public void rollback() {
      if (status.isCompleted()) {
        return;
      }
      try {
        transactionManager.rollback(status);
      } catch (TransactionException e) {
        throw new revision.TransactionException("Rollback failed on resource '" + resource + "'", e);
      }
    }
  }
}
