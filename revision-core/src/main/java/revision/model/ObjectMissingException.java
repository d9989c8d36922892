package revision.model;

/**
 * Thrown by {@link EntityModel#relation} when a relation points at an entity
 * that no longer exists, typically because it was deleted concurrently.
 *
 * <p>Relationship following treats this as "nothing further to follow".
 */
public final class ObjectMissingException extends RuntimeException {

  public ObjectMissingException(String message) {
    super(message);
  }

  public ObjectMissingException(String message, Throwable cause) {
    super(message, cause);
  }
}
