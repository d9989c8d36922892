package revision;

/**
 * Unchecked exception wrapping failures of the transactional resource that
 * surrounds a revision scope, such as a {@link java.sql.SQLException} raised
 * while committing.
 */
public final class TransactionException extends RevisionException {

  public TransactionException(String message, Throwable cause) {
    super(message, cause);
  }
}
