package revision;

import revision.context.RevisionContextManager;
import revision.spi.TransactionSupport;

import java.util.Objects;

/**
 * Marks blocks of code whose captured changes form one revision.
 *
 * <p>A scope is reusable: each {@link #begin()} opens a new block, and
 * {@link #execute} or {@link #wrap} run units of work in one. Blocks nest; only
 * the outermost block of a resource emits.
 *
 * <h2>Block lifecycle</h2>
 * <ol>
 *   <li>The transactional resource begins an atomic block, then a frame is pushed.</li>
 *   <li>{@link Block#commit()} pops the frame (emitting when outermost) and commits.</li>
 *   <li>{@link Block#close()} without a prior commit invalidates the frame, pops
 *       it without emitting, and rolls back.</li>
 * </ol>
 *
 * <pre>{@code
 * try (RevisionScope.Block block = revisions.createRevision().begin()) {
 *   revisions.setComment("Price update");
 *   catalog.updatePrices(changes);
 *   block.commit();
 * }
 *
 * Order saved = revisions.createRevision().execute(() -> orders.save(order));
 * }</pre>
 *
 * @see RevisionContextManager#createRevision(boolean, String)
 */
public final class RevisionScope {
  private final RevisionContextManager contextManager;
  private final boolean manageManually;
  private final String resource;

  public RevisionScope(RevisionContextManager contextManager, boolean manageManually, String resource) {
    this.contextManager = Objects.requireNonNull(contextManager, "contextManager");
    this.manageManually = manageManually;
    this.resource = Objects.requireNonNull(resource, "resource");
  }

  public boolean isManageManually() {
    return manageManually;
  }

  public String resource() {
    return resource;
  }

  /**
   * Opens a block on the calling thread. Use with try-with-resources and call
   * {@link Block#commit()} as the last statement of the body.
   *
   * @return the open block
   */
  public Block begin() {
    TransactionSupport.AtomicBlock transaction = contextManager.transactionSupport().begin(resource);
    try {
      contextManager.start(manageManually, resource);
    } catch (RuntimeException e) {
      try {
        transaction.rollback();
      } catch (RuntimeException suppressed) {
        e.addSuppressed(suppressed);
      }
      throw e;
    }
    return new Block(transaction, Thread.currentThread(), contextManager.depth());
  }

  /**
   * Runs {@code work} in a new block. A failure of the work rolls the block back
   * and is rethrown unchanged.
   *
   * @param work the unit of work
   * @return the work's result
   * @throws E the work's failure
   */
  public <V, E extends Exception> V execute(RevisionWork<V, E> work) throws E {
    Objects.requireNonNull(work, "work");
    try (Block block = begin()) {
      V result = work.execute();
      block.commit();
      return result;
    }
  }

  /**
   * Returns a unit of work that runs {@code work} in a new block each time it
   * is executed.
   */
  public <V, E extends Exception> RevisionWork<V, E> wrap(RevisionWork<V, E> work) {
    Objects.requireNonNull(work, "work");
    return () -> execute(work);
  }

  /**
   * One open revision block. Closing it without {@link #commit()} discards its
   * captures and rolls back its transaction.
   */
  public final class Block implements AutoCloseable {
    private final TransactionSupport.AtomicBlock transaction;
    private final Thread owner;
    private final int depth;
    private boolean completed;

    private Block(TransactionSupport.AtomicBlock transaction, Thread owner, int depth) {
      this.transaction = transaction;
      this.owner = owner;
      this.depth = depth;
    }

    /**
     * Ends the block normally. If the emission fails the transaction is rolled
     * back and the failure propagates. A second call is a no-op.
     *
     * @throws RevisionManagementException if a block nested in this one is still
     *         open, or the block was opened on another thread
     */
    public void commit() {
      if (completed) {
        return;
      }
      requireInnermost();
      completed = true;
      try {
        contextManager.end(resource);
      } catch (RuntimeException e) {
        try {
          transaction.rollback();
        } catch (RuntimeException suppressed) {
          e.addSuppressed(suppressed);
        }
        throw e;
      }
      transaction.commit();
    }

    /**
     * Returns whether {@link #commit()} or {@link #close()} already ended the block.
     */
    public boolean isCompleted() {
      return completed;
    }

    @Override
    public void close() {
      if (completed) {
        return;
      }
      requireInnermost();
      completed = true;
      try {
        contextManager.invalidate();
      } finally {
        try {
          contextManager.end(resource);
        } finally {
          transaction.rollback();
        }
      }
    }

    private void requireInnermost() {
      if (Thread.currentThread() != owner || contextManager.depth() != depth) {
        throw new RevisionManagementException(
            "Revision blocks must be closed in reverse order on the thread that opened them");
      }
    }
  }
}
