package revision.model;

/**
 * Entity that reports on its own whether it has been persisted.
 *
 * <p>Relation traversal reaches entities of any type, including types no
 * manager has a model for. An unsaved entity implementing this interface ends
 * its branch even when its type is not registered.
 */
public interface Persistable {

  /**
   * Returns {@code true} if the entity has never been persisted.
   */
  boolean isNew();
}
