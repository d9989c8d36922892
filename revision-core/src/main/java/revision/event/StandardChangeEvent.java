package revision.event;

/**
 * Change events every persistence integration is expected to fire.
 */
public enum StandardChangeEvent implements ChangeEvent {
  /** After an entity was inserted or updated. */
  POST_SAVE,
  /** Before an entity is deleted, while it can still be read. */
  PRE_DELETE,
  /** After an entity was deleted. */
  POST_DELETE
}
