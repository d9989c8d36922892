package revision.spi;

/**
 * Abstracts the transactional resource a revision scope runs in, so the core
 * does not depend on a specific transaction manager.
 *
 * <p>Every revision scope calls {@link #begin(String)} once on entry and then
 * exactly one of {@link AtomicBlock#commit()} or {@link AtomicBlock#rollback()}
 * on exit. Blocks for the same resource nest: the outermost block is a real
 * transaction, inner blocks behave like savepoints. Blocks are closed in the
 * reverse order they were begun, on the thread that began them.
 *
 * <p>Implementations: {@code revision.jdbc.JdbcTransactionSupport} (manual JDBC),
 * {@code revision.spring.SpringTransactionSupport} (Spring-managed).
 */
public interface TransactionSupport {

  /**
   * Begins an atomic block on the named resource.
   *
   * @param resource the resource alias, e.g. {@code "default"}
   * @return the block to commit or roll back
   * @throws revision.TransactionException if the block cannot be started
   */
  AtomicBlock begin(String resource);

  /**
   * One atomic block. Completing a block twice is a no-op.
   */
  interface AtomicBlock {

    /**
     * Makes the block's work permanent, or folds it into the enclosing block
     * when nested.
     */
    void commit();

    /**
     * Discards the block's work.
     */
    void rollback();
  }

  /**
   * Transaction support for stores without transactions: blocks do nothing.
   */
  TransactionSupport NOOP = resource -> new AtomicBlock() {
    @Override
    public void commit() {
    }

    @Override
    public void rollback() {
    }
  };
}
