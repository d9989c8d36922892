package revision.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * {@link EntityModel} assembled from accessor functions.
 *
 * <pre>{@code
 * EntityModel<Order> orders = EntityModel.builder(Order.class, "shop", "order")
 *     .id(Order::getId)
 *     .field("reference", Order::getReference)
 *     .field("customer_id", o -> o.getCustomer().getId())
 *     .relation("customer", o -> Related.single(o.getCustomer()))
 *     .relation("lines", o -> Related.many(o.getLines()))
 *     .build();
 * }</pre>
 *
 * @param <T> the entity type
 */
public final class SimpleEntityModel<T> implements EntityModel<T> {
  private final Class<T> javaType;
  private final String appLabel;
  private final String modelName;
  private final EntityModel<? super T> concreteModel;
  private final Function<T, ?> idAccessor;
  private final Map<String, Function<T, ?>> fields;
  private final Map<String, Function<T, Related>> relations;
  private final List<String> fieldNames;

  private SimpleEntityModel(Builder<T> builder) {
    this.javaType = builder.javaType;
    this.appLabel = builder.appLabel;
    this.modelName = builder.modelName;
    this.concreteModel = builder.concreteModel;
    this.idAccessor = Objects.requireNonNull(builder.idAccessor, "id accessor");
    this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
    this.relations = Collections.unmodifiableMap(new LinkedHashMap<>(builder.relations));
    this.fieldNames = List.copyOf(fields.keySet());
  }

  @Override
  public Class<T> javaType() {
    return javaType;
  }

  @Override
  public String appLabel() {
    return appLabel;
  }

  @Override
  public String modelName() {
    return modelName;
  }

  @Override
  public EntityModel<? super T> concreteModel() {
    return concreteModel == null ? this : concreteModel;
  }

  @Override
  public Object id(T entity) {
    return idAccessor.apply(entity);
  }

  @Override
  public List<String> fieldNames() {
    return fieldNames;
  }

  @Override
  public Object fieldValue(T entity, String name) {
    Function<T, ?> accessor = fields.get(name);
    if (accessor == null) {
      throw new IllegalArgumentException(label() + " has no field '" + name + "'");
    }
    return accessor.apply(entity);
  }

  @Override
  public boolean hasRelation(String name) {
    return relations.containsKey(name);
  }

  @Override
  public Related relation(T entity, String name) {
    Function<T, Related> accessor = relations.get(name);
    if (accessor == null) {
      throw new IllegalArgumentException(label() + " has no relation '" + name + "'");
    }
    Related related = accessor.apply(entity);
    return related == null ? Related.none() : related;
  }

  @Override
  public String toString() {
    return label();
  }

  /**
   * Builder for {@link SimpleEntityModel}. Single use.
   *
   * @param <T> the entity type
   */
  public static final class Builder<T> {
    private final Class<T> javaType;
    private final String appLabel;
    private final String modelName;
    private EntityModel<? super T> concreteModel;
    private Function<T, ?> idAccessor;
    private final Map<String, Function<T, ?>> fields = new LinkedHashMap<>();
    private final Map<String, Function<T, Related>> relations = new LinkedHashMap<>();
    private final AtomicBoolean built = new AtomicBoolean(false);

    Builder(Class<T> javaType, String appLabel, String modelName) {
      this.javaType = Objects.requireNonNull(javaType, "javaType");
      this.appLabel = requireText(appLabel, "appLabel");
      this.modelName = requireText(modelName, "modelName");
    }

    /**
     * Sets the primary key accessor. <b>Required.</b> The accessor returns
     * {@code null} for entities that were never persisted.
     */
    public Builder<T> id(Function<T, ?> idAccessor) {
      this.idAccessor = Objects.requireNonNull(idAccessor, "idAccessor");
      return this;
    }

    /**
     * Adds a local field. Fields keep the order in which they are added.
     */
    public Builder<T> field(String name, Function<T, ?> accessor) {
      requireText(name, "name");
      Objects.requireNonNull(accessor, "accessor");
      if (fields.putIfAbsent(name, accessor) != null) {
        throw new IllegalArgumentException("Duplicate field '" + name + "'");
      }
      return this;
    }

    /**
     * Adds a named relation that adapters may follow.
     */
    public Builder<T> relation(String name, Function<T, Related> accessor) {
      requireText(name, "name");
      Objects.requireNonNull(accessor, "accessor");
      if (relations.putIfAbsent(name, accessor) != null) {
        throw new IllegalArgumentException("Duplicate relation '" + name + "'");
      }
      return this;
    }

    /**
     * Declares this model a proxy over {@code concreteModel}, sharing its storage.
     */
    public Builder<T> proxyOf(EntityModel<? super T> concreteModel) {
      this.concreteModel = Objects.requireNonNull(concreteModel, "concreteModel");
      return this;
    }

    public SimpleEntityModel<T> build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      return new SimpleEntityModel<>(this);
    }

    private static String requireText(String value, String name) {
      Objects.requireNonNull(value, name);
      if (value.isEmpty()) {
        throw new IllegalArgumentException(name + " cannot be empty");
      }
      return value;
    }
  }
}
