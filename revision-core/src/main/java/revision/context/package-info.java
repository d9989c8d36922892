/**
 * Per-thread stack of revision frames.
 *
 * <p>{@link revision.context.RevisionContextManager} opens a frame for every revision
 * scope. Nested frames start from a copy of their parent's revision state and hand it
 * back when they close cleanly; an invalidated frame is dropped without touching its
 * parent. The last frame of a resource to close emits the captured objects.
 */
package revision.context;
