package revision.spi;

/**
 * Observability hook for exporting revision counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this
 * interface to bridge into Micrometer or another monitoring system.
 */
public interface RevisionMetrics {

  /**
   * No-op instance that discards all metrics.
   */
  RevisionMetrics NOOP = new Noop();

  /**
   * Increments the count of revisions handed to revision listeners.
   */
  void incrementRevisionsEmitted();

  /**
   * Increments the count of outermost scopes that closed invalid, so that
   * nothing was emitted.
   */
  void incrementRevisionsDiscarded();

  /**
   * Records how many objects one emitted revision carried.
   *
   * @param objectCount live plus pre-serialized captures
   */
  default void recordObjectsPerRevision(int objectCount) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements RevisionMetrics {
    @Override
    public void incrementRevisionsEmitted() {
    }

    @Override
    public void incrementRevisionsDiscarded() {
    }
  }
}
