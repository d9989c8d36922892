package revision.context;

import revision.VersionData;

import java.util.Objects;

/**
 * One entity recorded in a revision: either the live entity, serialized when
 * the revision is stored, or data serialized at capture time.
 */
public sealed interface Capture permits Capture.Live, Capture.Serialized {

  /**
   * A live entity captured by a deferred event.
   */
  record Live(Object entity) implements Capture {
    public Live {
      Objects.requireNonNull(entity, "entity");
    }
  }

  /**
   * An entity serialized by an eager event.
   */
  record Serialized(VersionData data) implements Capture {
    public Serialized {
      Objects.requireNonNull(data, "data");
    }
  }
}
