package revision.event;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe in-memory {@link ChangeEventDispatcher}.
 *
 * <p>Persistence code calls {@link #fire} after (or before) mutating an entity;
 * every receiver subscribed for the entity's class and the event runs on the
 * calling thread, in subscription order. A receiver that throws aborts the
 * remaining receivers and the exception propagates to the caller, the same way
 * a failed capture aborts the surrounding unit of work.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * DefaultChangeEventDispatcher changes = new DefaultChangeEventDispatcher();
 * Revisions revisions = Revisions.builder().dispatcher(changes).build();
 * revisions.register(orders);
 *
 * orderRepository.save(order);
 * changes.fire(StandardChangeEvent.POST_SAVE, order);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Subscriptions may change concurrently with {@link #fire}; each fire sees a
 * consistent snapshot of the receivers.
 */
public final class DefaultChangeEventDispatcher implements ChangeEventDispatcher {

  private final Map<Key, CopyOnWriteArrayList<ChangeReceiver>> receivers = new ConcurrentHashMap<>();

  @Override
  public void subscribe(Class<?> entityType, ChangeEvent event, ChangeReceiver receiver) {
    Objects.requireNonNull(receiver, "receiver");
    receivers.computeIfAbsent(Key.of(entityType, event), ignored -> new CopyOnWriteArrayList<>())
        .addIfAbsent(receiver);
  }

  @Override
  public boolean unsubscribe(Class<?> entityType, ChangeEvent event, ChangeReceiver receiver) {
    Objects.requireNonNull(receiver, "receiver");
    CopyOnWriteArrayList<ChangeReceiver> subscribed = receivers.get(Key.of(entityType, event));
    return subscribed != null && subscribed.remove(receiver);
  }

  /**
   * Fires {@code event} for {@code entity}, invoking every matching receiver.
   *
   * @param event  the event that occurred
   * @param entity the mutated entity
   * @return the number of receivers invoked
   */
  public int fire(ChangeEvent event, Object entity) {
    Objects.requireNonNull(entity, "entity");
    List<ChangeReceiver> subscribed = receivers.get(Key.of(entity.getClass(), event));
    if (subscribed == null) {
      return 0;
    }
    int invoked = 0;
    for (ChangeReceiver receiver : subscribed) {
      receiver.onChange(event, entity);
      invoked++;
    }
    return invoked;
  }

  /**
   * Returns the number of receivers subscribed for the entity type and event.
   */
  public int receiverCount(Class<?> entityType, ChangeEvent event) {
    List<ChangeReceiver> subscribed = receivers.get(Key.of(entityType, event));
    return subscribed == null ? 0 : subscribed.size();
  }

  private record Key(Class<?> entityType, String eventName) {
    static Key of(Class<?> entityType, ChangeEvent event) {
      Objects.requireNonNull(entityType, "entityType");
      Objects.requireNonNull(event, "event");
      return new Key(entityType, event.name());
    }
  }
}
