package revision.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import revision.spi.RevisionMetrics;

import java.util.List;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link RevisionMetrics}.
 *
 * <h3>Meters</h3>
 * <ul>
 *   <li>{@code revision.emitted}: counter of revisions handed to listeners</li>
 *   <li>{@code revision.discarded}: counter of outermost scopes closed invalid</li>
 *   <li>{@code revision.objects}: summary of objects carried per emitted revision</li>
 * </ul>
 *
 * @see RevisionMetrics
 */
public final class MicrometerRevisionMetrics implements RevisionMetrics, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter emitted;
  private final Counter discarded;
  private final DistributionSummary objects;
  private volatile boolean closed;

  /**
   * Creates metrics with the default name prefix {@code "revision"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerRevisionMetrics(MeterRegistry registry) {
    this(registry, "revision");
  }

  /**
   * Creates metrics with a custom name prefix, for several context managers in
   * one registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "audit.revision"})
   */
  public MicrometerRevisionMetrics(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.emitted = Counter.builder(namePrefix + ".emitted")
        .description("Revisions handed to revision listeners")
        .register(registry);
    this.discarded = Counter.builder(namePrefix + ".discarded")
        .description("Outermost revision scopes that closed without emitting")
        .register(registry);
    this.objects = DistributionSummary.builder(namePrefix + ".objects")
        .description("Objects captured per emitted revision")
        .baseUnit("objects")
        .register(registry);
  }

  @Override
  public void incrementRevisionsEmitted() {
    if (closed) return;
    emitted.increment();
  }

  @Override
  public void incrementRevisionsDiscarded() {
    if (closed) return;
    discarded.increment();
  }

  @Override
  public void recordObjectsPerRevision(int objectCount) {
    if (closed) return;
    objects.record(objectCount);
  }

  /**
   * Removes the meters registered by this instance from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(emitted, discarded, objects)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
