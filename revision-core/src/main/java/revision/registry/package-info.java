/**
 * Registration of versioned models.
 *
 * <p>{@link revision.registry.RevisionManager} maps entity classes to
 * {@link revision.VersionAdapter}s, listens for their change events, and publishes the
 * revisions captured for its models.
 */
package revision.registry;
