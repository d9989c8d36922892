package revision;

/**
 * Thrown when revision state is accessed without an open revision scope on the
 * calling thread, or when a revision block is used incorrectly.
 *
 * <p>This signals a programming error; retrying the call will not help.
 */
public final class RevisionManagementException extends RevisionException {

  public RevisionManagementException(String message) {
    super(message);
  }
}
