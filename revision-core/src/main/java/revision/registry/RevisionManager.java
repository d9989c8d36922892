package revision.registry;

import revision.AdapterFactory;
import revision.AdapterOptions;
import revision.RegistrationException;
import revision.Revision;
import revision.RevisionListener;
import revision.VersionAdapter;
import revision.context.RevisionContextManager;
import revision.event.ChangeEvent;
import revision.event.ChangeEventDispatcher;
import revision.event.ChangeReceiver;
import revision.model.EntityModel;
import revision.model.Persistable;
import revision.model.VersionId;
import revision.spi.SerializationCodec;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Named registry of versioned models.
 *
 * <p>Registering a model creates its {@link VersionAdapter} and subscribes the
 * manager to the adapter's change events. When an event fires inside an open,
 * automatically managed revision scope, the entity is added to the scope:
 * eagerly serialized for the adapter's eager events, as a live entity otherwise.
 * When the outermost scope closes, the manager's {@link RevisionListener}s
 * receive the captures as a {@link Revision}.
 *
 * <h2>Slugs</h2>
 * <p>Each manager claims a process-wide unique slug on construction and keeps
 * it until {@link #close()}, so storage code can find a manager by name with
 * {@link #getManager(String)}.
 *
 * <h2>Thread Safety</h2>
 * <p>Registration is expected at startup but is safe under concurrent lookups.
 * Capture state lives in the {@link RevisionContextManager}, per thread.
 */
public final class RevisionManager implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RevisionManager.class.getName());

  private static final ConcurrentMap<String, RevisionManager> createdManagers = new ConcurrentHashMap<>();

  private final String slug;
  private final RevisionContextManager contextManager;
  private final ChangeEventDispatcher dispatcher;
  private final SerializationCodec codec;
  private final Map<Class<?>, VersionAdapter<?>> registeredModels = new ConcurrentHashMap<>();
  private final List<RevisionListener> listeners = new CopyOnWriteArrayList<>();
  private final ChangeReceiver receiver = this::onChange;
  private volatile boolean closed;

  /**
   * Creates a manager and claims its slug.
   *
   * @param slug           process-wide unique name
   * @param contextManager context the manager captures into
   * @param dispatcher     source of change events
   * @param codec          codec used by the adapters
   * @throws RegistrationException if another open manager uses the slug
   */
  public RevisionManager(String slug, RevisionContextManager contextManager,
      ChangeEventDispatcher dispatcher, SerializationCodec codec) {
    this.slug = Objects.requireNonNull(slug, "slug");
    this.contextManager = Objects.requireNonNull(contextManager, "contextManager");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.codec = Objects.requireNonNull(codec, "codec");
    if (createdManagers.putIfAbsent(slug, this) != null) {
      throw new RegistrationException("A revision manager has already been created with the slug '" + slug + "'");
    }
  }

  /**
   * Returns all open managers.
   */
  public static List<RevisionManager> getCreatedManagers() {
    return List.copyOf(createdManagers.values());
  }

  /**
   * Returns the open manager with the given slug.
   *
   * @throws RegistrationException if no open manager uses the slug
   */
  public static RevisionManager getManager(String slug) {
    RevisionManager manager = createdManagers.get(slug);
    if (manager == null) {
      throw new RegistrationException("No revision manager exists with the slug '" + slug + "'");
    }
    return manager;
  }

  public String slug() {
    return slug;
  }

  public RevisionContextManager contextManager() {
    return contextManager;
  }

  // Registration.

  /**
   * Returns whether {@code type} is registered with this manager.
   */
  public boolean isRegistered(Class<?> type) {
    return registeredModels.containsKey(type);
  }

  /**
   * Returns the registered entity classes.
   */
  public List<Class<?>> getRegisteredModels() {
    return List.copyOf(registeredModels.keySet());
  }

  /**
   * Registers a model with the default adapter.
   */
  public <T> EntityModel<T> register(EntityModel<T> model) {
    return register(model, VersionAdapter::new, AdapterOptions.DEFAULTS);
  }

  /**
   * Registers a model with the default adapter and the given overrides.
   */
  public <T> EntityModel<T> register(EntityModel<T> model, AdapterOptions options) {
    return register(model, VersionAdapter::new, options);
  }

  /**
   * Registers a model.
   *
   * @param model   the model to version
   * @param factory creates the adapter, typically a {@link VersionAdapter} subclass constructor
   * @param options overrides applied to the adapter
   * @return {@code model}
   * @throws RegistrationException if the model is already registered or the options are invalid
   */
  public <T> EntityModel<T> register(EntityModel<T> model, AdapterFactory<T> factory, AdapterOptions options) {
    Objects.requireNonNull(model, "model");
    Objects.requireNonNull(factory, "factory");
    Objects.requireNonNull(options, "options");
    requireOpen();
    Class<T> type = model.javaType();
    if (isRegistered(type)) {
      throw alreadyRegistered(type);
    }
    VersionAdapter<T> adapter = Objects.requireNonNull(factory.create(model, options, codec), "adapter");
    if (registeredModels.putIfAbsent(type, adapter) != null) {
      throw alreadyRegistered(type);
    }
    for (ChangeEvent event : adapter.getAllEvents()) {
      dispatcher.subscribe(type, event, receiver);
    }
    logger.log(Level.FINE, "Registered {0} with revision manager ''{1}''", new Object[] {model.label(), slug});
    return model;
  }

  /**
   * Returns the adapter of a registered type.
   *
   * @throws RegistrationException if the type is not registered
   */
  @SuppressWarnings("unchecked")
  public <T> VersionAdapter<T> getAdapter(Class<T> type) {
    VersionAdapter<?> adapter = registeredModels.get(type);
    if (adapter == null) {
      throw notRegistered(type);
    }
    return (VersionAdapter<T>) adapter;
  }

  /**
   * Returns the adapter registered for the entity's exact class.
   *
   * @throws RegistrationException if the class is not registered
   */
  @SuppressWarnings("unchecked")
  public VersionAdapter<Object> adapterFor(Object entity) {
    Objects.requireNonNull(entity, "entity");
    VersionAdapter<?> adapter = getAdapter(entity.getClass());
    return (VersionAdapter<Object>) adapter;
  }

  /**
   * Removes a model from version control and unsubscribes its events.
   *
   * @throws RegistrationException if the type is not registered
   */
  public void unregister(Class<?> type) {
    VersionAdapter<?> adapter = registeredModels.remove(type);
    if (adapter == null) {
      throw notRegistered(type);
    }
    for (ChangeEvent event : adapter.getAllEvents()) {
      dispatcher.unsubscribe(type, event, receiver);
    }
    logger.log(Level.FINE, "Unregistered {0} from revision manager ''{1}''", new Object[] {type.getName(), slug});
  }

  // Revision listeners.

  public void addRevisionListener(RevisionListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public boolean removeRevisionListener(RevisionListener listener) {
    return listeners.remove(listener);
  }

  /**
   * Hands an emitted revision to the listeners, in registration order.
   */
  public void publish(Revision revision) {
    Objects.requireNonNull(revision, "revision");
    for (RevisionListener listener : listeners) {
      listener.onRevision(revision);
    }
  }

  // Serialization.

  /**
   * Collects {@code root} and every entity reachable from it through the
   * followed relations of the registered adapters.
   *
   * <p>Each entity appears once, keyed by its {@link VersionId}, which also
   * stops traversal at cycles. Entities that were never persisted, such as one
   * created and deleted in the same revision, end their branch and are left
   * out. This holds for unregistered types too when they implement
   * {@link Persistable}.
   *
   * @return the distinct reachable entities, root first
   * @throws RegistrationException if a reachable saved entity's model is not registered
   */
  public Collection<Object> followRelationships(Object root) {
    Objects.requireNonNull(root, "root");
    Map<VersionId, Object> followed = new LinkedHashMap<>();
    Deque<Object> pending = new ArrayDeque<>();
    pending.push(root);
    while (!pending.isEmpty()) {
      Object entity = pending.pop();
      @SuppressWarnings("unchecked")
      VersionAdapter<Object> adapter = (VersionAdapter<Object>) registeredModels.get(entity.getClass());
      if (adapter == null) {
        if (entity instanceof Persistable persistable && persistable.isNew()) {
          continue;
        }
        throw notRegistered(entity.getClass());
      }
      if (adapter.getModel().id(entity) == null) {
        continue;
      }
      VersionId id = adapter.getVersionId(entity);
      if (followed.containsKey(id)) {
        continue;
      }
      followed.put(id, entity);
      List<Object> related = adapter.getFollowedRelations(entity);
      for (int i = related.size() - 1; i >= 0; i--) {
        pending.push(related.get(i));
      }
    }
    return Collections.unmodifiableCollection(new ArrayList<>(followed.values()));
  }

  // Change receiver.

  private void onChange(ChangeEvent event, Object entity) {
    if (!contextManager.isActive() || contextManager.isManagingManually()) {
      return;
    }
    VersionAdapter<Object> adapter = adapterFor(entity);
    if (adapter.isEager(event)) {
      contextManager.addToContextEager(this, entity);
    } else {
      contextManager.addToContext(this, entity);
    }
  }

  /**
   * Unregisters every model and releases the slug. Idempotent.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    for (Class<?> type : getRegisteredModels()) {
      try {
        unregister(type);
      } catch (RegistrationException e) {
        // Concurrently unregistered.
        logger.log(Level.FINE, "Model already unregistered: " + type.getName(), e);
      }
    }
    createdManagers.remove(slug, this);
  }

  private void requireOpen() {
    if (closed) {
      throw new RegistrationException("Revision manager '" + slug + "' is closed");
    }
  }

  private static RegistrationException alreadyRegistered(Class<?> type) {
    return new RegistrationException(type.getName() + " has already been registered");
  }

  private static RegistrationException notRegistered(Class<?> type) {
    return new RegistrationException(type.getName() + " has not been registered");
  }

  @Override
  public String toString() {
    return "RevisionManager[" + slug + "]";
  }
}
