package revision.event;

import java.util.Objects;

/**
 * A simple string-based change event for integrations that define their own
 * events at runtime.
 *
 * <pre>{@code
 * ChangeEvent archived = StringChangeEvent.of("POST_ARCHIVE");
 * }</pre>
 *
 * <p>Dispatchers and adapters match events by {@link #name()}, so
 * {@code StringChangeEvent.of("POST_SAVE")} triggers the same captures as
 * {@link StandardChangeEvent#POST_SAVE}.
 */
public final class StringChangeEvent implements ChangeEvent {

  private final String name;

  private StringChangeEvent(String name) {
    this.name = Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("Change event name cannot be empty");
    }
  }

  /**
   * Creates a change event from a string.
   *
   * @param name the event name
   * @return the event
   * @throws NullPointerException if name is null
   * @throws IllegalArgumentException if name is empty
   */
  public static StringChangeEvent of(String name) {
    return new StringChangeEvent(name);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof StringChangeEvent)) return false;
    StringChangeEvent that = (StringChangeEvent) o;
    return name.equals(that.name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
