package revision.event;

/**
 * Subscription point for entity change events.
 *
 * <p>The persistence integration owns the dispatcher and fires events on it;
 * {@link revision.registry.RevisionManager} subscribes one receiver per
 * registered entity type and event. Events are matched by
 * {@link ChangeEvent#name() name} and the exact entity class.
 *
 * @see DefaultChangeEventDispatcher
 */
public interface ChangeEventDispatcher {

  /**
   * Subscribes {@code receiver} to {@code event} fired for entities of exactly
   * {@code entityType}. Subscribing the same receiver twice has no further effect.
   *
   * @param entityType the entity class
   * @param event      the change event
   * @param receiver   the receiver to invoke
   */
  void subscribe(Class<?> entityType, ChangeEvent event, ChangeReceiver receiver);

  /**
   * Removes a subscription made with {@link #subscribe}.
   *
   * @return {@code true} if the receiver was subscribed
   */
  boolean unsubscribe(Class<?> entityType, ChangeEvent event, ChangeReceiver receiver);
}
