package revision;

import revision.codec.JsonSerializationCodec;
import revision.context.RevisionContextManager;
import revision.event.ChangeEventDispatcher;
import revision.event.DefaultChangeEventDispatcher;
import revision.model.EntityModel;
import revision.registry.RevisionManager;
import revision.spi.RevisionMetrics;
import revision.spi.SerializationCodec;
import revision.spi.TransactionSupport;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Composite entry point that wires a {@link RevisionContextManager} and a
 * default {@link RevisionManager} into a single {@link AutoCloseable} unit.
 *
 * <p>The instance methods mirror the day-to-day API: register models, open
 * revision scopes, and set the user, comment and meta of the current revision.
 * Additional managers can share the context via {@link #newManager(String)}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * DefaultChangeEventDispatcher changes = new DefaultChangeEventDispatcher();
 * try (Revisions revisions = Revisions.builder()
 *     .transactionSupport(new JdbcTransactionSupport(connections))
 *     .dispatcher(changes)
 *     .revisionListener(versionStore::save)
 *     .build()) {
 *   revisions.register(orders);
 *   revisions.createRevision().execute(() -> {
 *     revisions.setUser(currentUser);
 *     orderService.place(order);
 *     return null;
 *   });
 * }
 * }</pre>
 *
 * @see RevisionScope
 * @see RevisionManager
 */
public final class Revisions implements AutoCloseable {
  public static final String DEFAULT_SLUG = "default";

  private final RevisionContextManager contextManager;
  private final RevisionManager manager;
  private final ChangeEventDispatcher dispatcher;
  private final SerializationCodec codec;

  private Revisions(RevisionContextManager contextManager, RevisionManager manager,
      ChangeEventDispatcher dispatcher, SerializationCodec codec) {
    this.contextManager = contextManager;
    this.manager = manager;
    this.dispatcher = dispatcher;
    this.codec = codec;
  }

  public static Builder builder() {
    return new Builder();
  }

  public RevisionContextManager contextManager() {
    return contextManager;
  }

  /**
   * The default manager.
   */
  public RevisionManager manager() {
    return manager;
  }

  public ChangeEventDispatcher dispatcher() {
    return dispatcher;
  }

  /**
   * Creates another manager on the same context, dispatcher and codec. The
   * caller owns it and must close it.
   *
   * @throws RegistrationException if the slug is in use
   */
  public RevisionManager newManager(String slug) {
    return new RevisionManager(slug, contextManager, dispatcher, codec);
  }

  // Registration with the default manager.

  public <T> EntityModel<T> register(EntityModel<T> model) {
    return manager.register(model);
  }

  public <T> EntityModel<T> register(EntityModel<T> model, AdapterOptions options) {
    return manager.register(model, options);
  }

  public <T> EntityModel<T> register(EntityModel<T> model, AdapterFactory<T> factory, AdapterOptions options) {
    return manager.register(model, factory, options);
  }

  public boolean isRegistered(Class<?> type) {
    return manager.isRegistered(type);
  }

  public void unregister(Class<?> type) {
    manager.unregister(type);
  }

  public <T> VersionAdapter<T> getAdapter(Class<T> type) {
    return manager.getAdapter(type);
  }

  public List<Class<?>> getRegisteredModels() {
    return manager.getRegisteredModels();
  }

  public void addRevisionListener(RevisionListener listener) {
    manager.addRevisionListener(listener);
  }

  // Context management.

  public RevisionScope createRevision() {
    return contextManager.createRevision();
  }

  public RevisionScope createRevision(boolean manageManually) {
    return contextManager.createRevision(manageManually);
  }

  public RevisionScope createRevision(boolean manageManually, String resource) {
    return contextManager.createRevision(manageManually, resource);
  }

  /**
   * Adds an entity of a model registered with the default manager to the
   * current revision. Works in manually managed scopes too.
   */
  public void add(Object entity) {
    contextManager.addToContext(manager, entity);
  }

  // Revision meta data.

  public Object getUser() {
    return contextManager.getUser();
  }

  public void setUser(Object user) {
    contextManager.setUser(user);
  }

  public String getComment() {
    return contextManager.getComment();
  }

  public void setComment(String comment) {
    contextManager.setComment(comment);
  }

  public void addMeta(Object meta) {
    contextManager.addMeta(meta);
  }

  public boolean getIgnoreDuplicates() {
    return contextManager.getIgnoreDuplicates();
  }

  public void setIgnoreDuplicates(boolean ignoreDuplicates) {
    contextManager.setIgnoreDuplicates(ignoreDuplicates);
  }

  /**
   * Closes the default manager: unsubscribes its models and releases its slug.
   */
  @Override
  public void close() {
    manager.close();
  }

  /**
   * Builder for {@link Revisions}. Every setting is optional.
   */
  public static final class Builder {
    private TransactionSupport transactionSupport = TransactionSupport.NOOP;
    private ChangeEventDispatcher dispatcher;
    private SerializationCodec codec = JsonSerializationCodec.INSTANCE;
    private RevisionMetrics metrics = RevisionMetrics.NOOP;
    private String defaultResource = RevisionContextManager.DEFAULT_RESOURCE;
    private String slug = DEFAULT_SLUG;
    private final List<RevisionListener> listeners = new ArrayList<>();
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {
    }

    /**
     * Transactional resource wrapped around every scope. Defaults to
     * {@link TransactionSupport#NOOP}.
     */
    public Builder transactionSupport(TransactionSupport transactionSupport) {
      this.transactionSupport = Objects.requireNonNull(transactionSupport, "transactionSupport");
      return this;
    }

    /**
     * Source of change events. Defaults to a new {@link DefaultChangeEventDispatcher}.
     */
    public Builder dispatcher(ChangeEventDispatcher dispatcher) {
      this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
      return this;
    }

    /**
     * Codec used by adapters. Defaults to {@link JsonSerializationCodec}.
     */
    public Builder codec(SerializationCodec codec) {
      this.codec = Objects.requireNonNull(codec, "codec");
      return this;
    }

    public Builder metrics(RevisionMetrics metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    /**
     * Resource alias for scopes that name none. Defaults to {@code "default"}.
     */
    public Builder defaultResource(String defaultResource) {
      Objects.requireNonNull(defaultResource, "defaultResource");
      if (defaultResource.isEmpty()) {
        throw new IllegalArgumentException("defaultResource cannot be empty");
      }
      this.defaultResource = defaultResource;
      return this;
    }

    /**
     * Slug of the default manager. Defaults to {@value Revisions#DEFAULT_SLUG}.
     */
    public Builder slug(String slug) {
      Objects.requireNonNull(slug, "slug");
      if (slug.isEmpty()) {
        throw new IllegalArgumentException("slug cannot be empty");
      }
      this.slug = slug;
      return this;
    }

    /**
     * Adds a listener to the default manager.
     */
    public Builder revisionListener(RevisionListener listener) {
      listeners.add(Objects.requireNonNull(listener, "listener"));
      return this;
    }

    /**
     * @throws RegistrationException if the slug is already claimed
     * @throws IllegalStateException if called twice
     */
    public Revisions build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      ChangeEventDispatcher changes = dispatcher == null ? new DefaultChangeEventDispatcher() : dispatcher;
      RevisionContextManager context = new RevisionContextManager(transactionSupport, metrics, defaultResource);
      RevisionManager defaultManager = new RevisionManager(slug, context, changes, codec);
      for (RevisionListener listener : listeners) {
        defaultManager.addRevisionListener(listener);
      }
      return new Revisions(context, defaultManager, changes, codec);
    }
  }
}
