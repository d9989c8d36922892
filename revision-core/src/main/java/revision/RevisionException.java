package revision;

/**
 * Base class for failures raised by the revision core.
 */
public class RevisionException extends RuntimeException {

  public RevisionException(String message) {
    super(message);
  }

  public RevisionException(String message, Throwable cause) {
    super(message, cause);
  }
}
