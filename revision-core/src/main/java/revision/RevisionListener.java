package revision;

/**
 * Receives each revision a {@link revision.registry.RevisionManager} emits when an
 * outermost revision scope closes cleanly.
 *
 * <h2>Execution Model</h2>
 * <p>Listeners run synchronously on the thread closing the scope, inside the
 * scope's transaction and before it commits. Storage listeners can therefore
 * write the revision in the same transaction as the captured changes.
 *
 * <h2>Error Handling</h2>
 * <p>An exception thrown by a listener skips the remaining listeners, rolls the
 * transaction back, and propagates to the code that closed the scope.
 *
 * <pre>{@code
 * revisions.addRevisionListener(revision -> versionStore.save(revision));
 * }</pre>
 */
@FunctionalInterface
public interface RevisionListener {

  /**
   * Processes an emitted revision.
   *
   * @param revision the captured objects and metadata
   */
  void onRevision(Revision revision);
}
