package revision.event;

/**
 * A kind of entity mutation that can trigger a capture, such as "saved" or
 * "about to be deleted".
 *
 * <p>Implement this interface with an enum for a fixed set of events, or use
 * {@link StringChangeEvent} for events named at runtime. The built-in events are
 * in {@link StandardChangeEvent}.
 */
public interface ChangeEvent {

  /**
   * Returns the event name. Two events with the same name are the same event.
   */
  String name();
}
