package revision;

/**
 * Thrown for invalid registrations: registering a model twice, looking up or
 * unregistering a model that was never registered, claiming a manager slug that
 * is already in use, resolving an unknown slug, or declaring adapter options the
 * model cannot satisfy.
 */
public final class RegistrationException extends RevisionException {

  public RegistrationException(String message) {
    super(message);
  }
}
