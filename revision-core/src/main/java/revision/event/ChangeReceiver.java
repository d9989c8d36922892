package revision.event;

/**
 * Callback subscribed to a {@link ChangeEventDispatcher} for one entity type
 * and event.
 */
@FunctionalInterface
public interface ChangeReceiver {

  /**
   * Called synchronously, inside the mutation's own call, after a matching
   * change event fired.
   *
   * @param event  the event that fired
   * @param entity the mutated entity
   */
  void onChange(ChangeEvent event, Object entity);
}
