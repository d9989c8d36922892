package revision.model;

import java.util.List;
import java.util.Objects;

/**
 * Result of resolving a named relation on an entity.
 *
 * <p>A relation resolves to nothing, to a single related entity, or to a
 * collection of related entities. Callers switch over the three cases instead
 * of inspecting the runtime type of the related value.
 */
public sealed interface Related permits Related.None, Related.Single, Related.Many {

  /**
   * Returns the shared empty result.
   */
  static Related none() {
    return None.INSTANCE;
  }

  /**
   * Wraps a single related entity, or returns {@link #none()} for {@code null}.
   */
  static Related single(Object entity) {
    return entity == null ? none() : new Single(entity);
  }

  /**
   * Wraps a collection of related entities. A {@code null} collection is
   * treated as empty.
   */
  static Related many(Iterable<?> entities) {
    return entities == null ? new Many(List.of()) : new Many(entities);
  }

  /**
   * No related entity.
   */
  final class None implements Related {
    private static final None INSTANCE = new None();

    private None() {
    }

    @Override
    public String toString() {
      return "Related.None";
    }
  }

  /**
   * Exactly one related entity.
   */
  record Single(Object entity) implements Related {
    public Single {
      Objects.requireNonNull(entity, "entity");
    }
  }

  /**
   * Zero or more related entities.
   */
  record Many(Iterable<?> entities) implements Related {
    public Many {
      Objects.requireNonNull(entities, "entities");
    }
  }
}
