package revision.model;

import java.util.List;

/**
 * Metadata describing one trackable entity type: how it is labelled, how its
 * identity and field values are read, and how its relations are resolved.
 *
 * <p>Implementations are normally produced with {@link #builder(Class, String, String)};
 * adapters for an existing persistence layer can implement this interface directly.
 *
 * @param <T> the entity type
 * @see SimpleEntityModel
 */
public interface EntityModel<T> {

  /**
   * The Java type this model describes. Change events are matched against this
   * exact class.
   */
  Class<T> javaType();

  /**
   * Application or schema the model belongs to.
   */
  String appLabel();

  /**
   * Model name, unique within its {@link #appLabel()}.
   */
  String modelName();

  /**
   * Returns {@code appLabel.modelName}.
   */
  default String label() {
    return appLabel() + "." + modelName();
  }

  /**
   * Returns the model whose storage this model shares. A proxy over another
   * model returns that model; everything else returns itself.
   */
  default EntityModel<? super T> concreteModel() {
    return this;
  }

  /**
   * Returns the primary key of the entity, or {@code null} if it has never been
   * persisted.
   */
  Object id(T entity);

  /**
   * Local field names in declaration order.
   */
  List<String> fieldNames();

  /**
   * Returns whether {@code name} is one of {@link #fieldNames()}.
   */
  default boolean hasField(String name) {
    return fieldNames().contains(name);
  }

  /**
   * Reads a field value from the entity.
   *
   * @throws IllegalArgumentException if the field does not exist
   */
  Object fieldValue(T entity, String name);

  /**
   * Returns whether the model can resolve the named relation.
   */
  boolean hasRelation(String name);

  /**
   * Resolves a named relation on the entity.
   *
   * @throws ObjectMissingException if the relation refers to an entity that no longer exists
   * @throws IllegalArgumentException if the relation does not exist
   */
  Related relation(T entity, String name);

  /**
   * Starts a builder for a lambda-backed model.
   *
   * @param javaType  the entity class
   * @param appLabel  application label
   * @param modelName model name
   * @param <T>       the entity type
   * @return a new builder
   */
  static <T> SimpleEntityModel.Builder<T> builder(Class<T> javaType, String appLabel, String modelName) {
    return new SimpleEntityModel.Builder<>(javaType, appLabel, modelName);
  }
}
