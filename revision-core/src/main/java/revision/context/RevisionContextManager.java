package revision.context;

import revision.Revision;
import revision.RevisionManagementException;
import revision.RevisionScope;
import revision.VersionAdapter;
import revision.VersionData;
import revision.model.VersionId;
import revision.registry.RevisionManager;
import revision.spi.RevisionMetrics;
import revision.spi.TransactionSupport;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tracks the open revision scopes of each thread and collects the objects
 * captured inside them.
 *
 * <p>Every thread has its own stack of frames, created when its first scope
 * opens and discarded when its last scope closes, so no locking is needed and a
 * scope on one thread never sees captures made on another.
 *
 * <p>When the last open scope of a transactional resource closes and its frame
 * is not invalid, each manager with captures emits one {@link Revision} to its
 * listeners. The frame is then popped and, when nested in another scope of the
 * same thread, joined into its parent.
 *
 * <p>Accessors for the current revision throw {@link RevisionManagementException}
 * when no scope is open on the calling thread.
 *
 * <pre>{@code
 * RevisionContextManager context = new RevisionContextManager(txSupport, RevisionMetrics.NOOP, "default");
 * context.createRevision().execute(() -> {
 *   context.setComment("Imported orders");
 *   importer.run();
 *   return null;
 * });
 * }</pre>
 *
 * @see RevisionScope
 * @see RevisionManager
 */
public final class RevisionContextManager {
  public static final String DEFAULT_RESOURCE = "default";

  private static final Logger logger = Logger.getLogger(RevisionContextManager.class.getName());

  private final ThreadLocal<ContextStack> stacks = new ThreadLocal<>();
  private final TransactionSupport transactionSupport;
  private final RevisionMetrics metrics;
  private final String defaultResource;

  /**
   * Creates a context manager without transactions or metrics, for the
   * {@value #DEFAULT_RESOURCE} resource.
   */
  public RevisionContextManager() {
    this(TransactionSupport.NOOP, RevisionMetrics.NOOP, DEFAULT_RESOURCE);
  }

  /**
   * Creates a context manager.
   *
   * @param transactionSupport transactional resource wrapped around each scope
   * @param metrics            metrics exporter; {@code null} defaults to {@link RevisionMetrics#NOOP}
   * @param defaultResource    resource alias used when a scope names none
   */
  public RevisionContextManager(TransactionSupport transactionSupport, RevisionMetrics metrics,
      String defaultResource) {
    this.transactionSupport = Objects.requireNonNull(transactionSupport, "transactionSupport");
    this.metrics = metrics == null ? RevisionMetrics.NOOP : metrics;
    this.defaultResource = Objects.requireNonNull(defaultResource, "defaultResource");
  }

  public TransactionSupport transactionSupport() {
    return transactionSupport;
  }

  public String defaultResource() {
    return defaultResource;
  }

  /**
   * Returns whether a revision scope is open on the calling thread.
   */
  public boolean isActive() {
    ContextStack stack = stacks.get();
    return stack != null && !stack.isEmpty();
  }

  /**
   * Returns the number of scopes open on the calling thread.
   */
  public int depth() {
    ContextStack stack = stacks.get();
    return stack == null ? 0 : stack.frames.size();
  }

  private ContextFrame currentFrame() {
    ContextStack stack = stacks.get();
    if (stack == null || stack.isEmpty()) {
      throw new RevisionManagementException("There is no active revision for this thread");
    }
    return stack.current();
  }

  // Scope lifecycle, driven by RevisionScope.

  /**
   * Opens a frame. Nested frames fork the current one; the first frame of the
   * thread starts empty.
   *
   * @param manageManually whether change events are ignored inside the frame
   * @param resource       the transactional resource the scope runs in
   */
  public void start(boolean manageManually, String resource) {
    Objects.requireNonNull(resource, "resource");
    ContextStack stack = stacks.get();
    if (stack == null) {
      stack = new ContextStack();
      stacks.set(stack);
    }
    ContextFrame frame = stack.isEmpty()
        ? ContextFrame.root(manageManually)
        : stack.current().fork(manageManually);
    stack.push(frame, resource);
  }

  /**
   * Marks the current frame invalid, so that it emits nothing and is not
   * joined into its parent. Idempotent.
   */
  public void invalidate() {
    currentFrame().invalid = true;
  }

  /**
   * Closes the current frame.
   *
   * <p>If this was the last open scope of {@code resource} and the frame is
   * valid, the captures are emitted before the frame is popped. The frame is
   * popped even if a listener fails; the failure then propagates.
   *
   * @param resource the resource passed to the matching {@link #start}
   * @throws RevisionManagementException if no scope is open for {@code resource}
   */
  public void end(String resource) {
    Objects.requireNonNull(resource, "resource");
    ContextFrame frame = currentFrame();
    ContextStack stack = stacks.get();
    if (!stack.isOpen(resource)) {
      throw new RevisionManagementException("There is no active revision for resource '" + resource + "'");
    }
    int remaining = stack.release(resource);
    try {
      if (remaining == 0) {
        if (frame.invalid) {
          metrics.incrementRevisionsDiscarded();
        } else {
          emit(frame, resource);
        }
      }
    } finally {
      stack.pop();
      if (stack.isEmpty()) {
        stacks.remove();
      } else {
        stack.current().join(frame);
      }
    }
  }

  private void emit(ContextFrame frame, String resource) {
    for (Map.Entry<RevisionManager, Map<VersionId, Capture>> entry : frame.managerObjects.entrySet()) {
      Map<VersionId, Capture> captures = entry.getValue();
      if (captures.isEmpty()) {
        continue;
      }
      List<Object> objects = new ArrayList<>();
      List<VersionData> serialized = new ArrayList<>();
      for (Capture capture : captures.values()) {
        if (capture instanceof Capture.Live live) {
          objects.add(live.entity());
        } else if (capture instanceof Capture.Serialized data) {
          serialized.add(data.data());
        }
      }
      RevisionManager manager = entry.getKey();
      Revision revision = new Revision(manager, resource, objects, serialized,
          frame.user, frame.comment, frame.meta, frame.ignoreDuplicates);
      try {
        manager.publish(revision);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Revision listener failed for " + revision, e);
        throw e;
      }
      metrics.incrementRevisionsEmitted();
      metrics.recordObjectsPerRevision(revision.size());
      logger.log(Level.FINE, "Emitted {0}", revision);
    }
  }

  // Block-scoped properties.

  /**
   * Returns whether the current scope ignores change events.
   */
  public boolean isManagingManually() {
    return currentFrame().manageManually;
  }

  /**
   * Returns whether the current scope was invalidated.
   */
  public boolean isInvalid() {
    return currentFrame().invalid;
  }

  // Revision-scoped properties.

  public void setUser(Object user) {
    currentFrame().user = user;
  }

  public Object getUser() {
    return currentFrame().user;
  }

  public void setComment(String comment) {
    currentFrame().comment = comment == null ? "" : comment;
  }

  public String getComment() {
    return currentFrame().comment;
  }

  public void setIgnoreDuplicates(boolean ignoreDuplicates) {
    currentFrame().ignoreDuplicates = ignoreDuplicates;
  }

  public boolean getIgnoreDuplicates() {
    return currentFrame().ignoreDuplicates;
  }

  /**
   * Appends a meta record, stored by the listener next to the revision.
   */
  public void addMeta(Object meta) {
    Objects.requireNonNull(meta, "meta");
    currentFrame().meta.add(meta);
  }

  /**
   * Returns a copy of the meta records of the current revision.
   */
  public List<Object> getMeta() {
    return List.copyOf(currentFrame().meta);
  }

  /**
   * Adds a live entity to the current revision. Capturing the same entity again
   * replaces the earlier capture. Unsaved entities are keyed by
   * {@link VersionAdapter#getCaptureId}.
   *
   * @throws revision.RegistrationException if the entity's model is not registered with {@code manager}
   */
  public void addToContext(RevisionManager manager, Object entity) {
    Objects.requireNonNull(manager, "manager");
    ContextFrame frame = currentFrame();
    VersionAdapter<Object> adapter = manager.adapterFor(entity);
    frame.objectsFor(manager).put(adapter.getCaptureId(entity), new Capture.Live(entity));
  }

  /**
   * Serializes the entity and everything reachable through followed relations
   * now, and adds the snapshots to the current revision. The snapshots name the
   * resource of the innermost open scope.
   */
  public void addToContextEager(RevisionManager manager, Object entity) {
    Objects.requireNonNull(manager, "manager");
    ContextFrame frame = currentFrame();
    String resource = stacks.get().currentResource();
    Map<VersionId, Capture> objects = frame.objectsFor(manager);
    for (Object related : manager.followRelationships(entity)) {
      VersionAdapter<Object> adapter = manager.adapterFor(related);
      VersionData data = adapter.getVersionData(related, resource);
      objects.put(data.versionId(), new Capture.Serialized(data));
    }
  }

  // High-level context management.

  /**
   * Returns a scope on the default resource with automatic capture.
   */
  public RevisionScope createRevision() {
    return createRevision(false, defaultResource);
  }

  /**
   * Returns a scope on the default resource.
   */
  public RevisionScope createRevision(boolean manageManually) {
    return createRevision(manageManually, defaultResource);
  }

  /**
   * Returns a reusable scope that marks blocks of code as one revision.
   *
   * @param manageManually whether change events are ignored inside the scope
   * @param resource       the transactional resource; {@code null} selects the default
   */
  public RevisionScope createRevision(boolean manageManually, String resource) {
    return new RevisionScope(this, manageManually, resource == null ? defaultResource : resource);
  }
}
