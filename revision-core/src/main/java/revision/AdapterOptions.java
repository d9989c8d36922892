package revision;

import revision.event.ChangeEvent;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-registration overrides for a {@link VersionAdapter}.
 *
 * <p>Every option left unset keeps the adapter's default. {@link #DEFAULTS}
 * overrides nothing.
 *
 * <pre>{@code
 * revisions.register(orders, AdapterOptions.builder()
 *     .exclude("updated_at")
 *     .follow("lines", "customer")
 *     .eagerEvents(StandardChangeEvent.PRE_DELETE)
 *     .build());
 * }</pre>
 */
public final class AdapterOptions {
  public static final AdapterOptions DEFAULTS = builder().build();

  private final List<String> fields;
  private final List<String> exclude;
  private final List<String> follow;
  private final String format;
  private final Boolean forConcreteModel;
  private final List<ChangeEvent> events;
  private final List<ChangeEvent> eagerEvents;

  private AdapterOptions(Builder builder) {
    this.fields = builder.fields;
    this.exclude = builder.exclude;
    this.follow = builder.follow;
    this.format = builder.format;
    this.forConcreteModel = builder.forConcreteModel;
    this.events = builder.events;
    this.eagerEvents = builder.eagerEvents;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Explicit field list, or {@code null} to keep the adapter default. */
  public List<String> fields() {
    return fields;
  }

  public List<String> exclude() {
    return exclude;
  }

  public List<String> follow() {
    return follow;
  }

  public String format() {
    return format;
  }

  public Boolean forConcreteModel() {
    return forConcreteModel;
  }

  public List<ChangeEvent> events() {
    return events;
  }

  public List<ChangeEvent> eagerEvents() {
    return eagerEvents;
  }

  /**
   * Builder for {@link AdapterOptions}. Single use.
   */
  public static final class Builder {
    private List<String> fields;
    private List<String> exclude;
    private List<String> follow;
    private String format;
    private Boolean forConcreteModel;
    private List<ChangeEvent> events;
    private List<ChangeEvent> eagerEvents;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {
    }

    /**
     * Serializes only the named fields instead of all fields.
     */
    public Builder fields(String... fields) {
      this.fields = copy(fields, "fields");
      return this;
    }

    /**
     * Leaves the named fields out of the serialized data.
     */
    public Builder exclude(String... exclude) {
      this.exclude = copy(exclude, "exclude");
      return this;
    }

    /**
     * Names relations whose targets are captured together with the entity.
     */
    public Builder follow(String... follow) {
      this.follow = copy(follow, "follow");
      return this;
    }

    /**
     * Serialization format passed to the codec.
     */
    public Builder format(String format) {
      this.format = Objects.requireNonNull(format, "format");
      return this;
    }

    /**
     * Whether a proxy model is identified by its concrete model ({@code true})
     * or gets a history of its own ({@code false}).
     */
    public Builder forConcreteModel(boolean forConcreteModel) {
      this.forConcreteModel = forConcreteModel;
      return this;
    }

    /**
     * Events that capture the entity when the outermost scope closes.
     */
    public Builder events(ChangeEvent... events) {
      this.events = copy(events, "events");
      return this;
    }

    /**
     * Events that serialize the entity immediately, for events after which the
     * entity may no longer exist.
     */
    public Builder eagerEvents(ChangeEvent... eagerEvents) {
      this.eagerEvents = copy(eagerEvents, "eagerEvents");
      return this;
    }

    public AdapterOptions build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      return new AdapterOptions(this);
    }

    private static <E> List<E> copy(E[] values, String name) {
      Objects.requireNonNull(values, name);
      return List.copyOf(Arrays.asList(values));
    }
  }
}
