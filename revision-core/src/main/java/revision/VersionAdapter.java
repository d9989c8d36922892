package revision;

import revision.codec.JsonSerializationCodec;
import revision.event.ChangeEvent;
import revision.event.StandardChangeEvent;
import revision.model.EntityModel;
import revision.model.ObjectMissingException;
import revision.model.Related;
import revision.model.VersionId;
import revision.spi.SerializationCodec;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Describes how entities of one registered model are captured: which fields
 * are serialized, which relations are followed, which format is used, and
 * which change events trigger a capture.
 *
 * <p>Defaults: all fields, nothing excluded or followed, {@code "json"} format,
 * proxies identified by their concrete model, {@link StandardChangeEvent#POST_SAVE}
 * as the only (deferred) event and no eager events. {@link AdapterOptions}
 * override the defaults; subclasses may override any method.
 *
 * <p>An adapter is immutable once created. The options are validated against
 * the model and codec in the constructor, so a misconfigured registration fails
 * with a {@link RegistrationException} before any event is subscribed.
 *
 * @param <T> the entity type
 */
public class VersionAdapter<T> {
  private static final Logger logger = Logger.getLogger(VersionAdapter.class.getName());

  private final EntityModel<T> model;
  private final SerializationCodec codec;
  private final List<String> fields;
  private final List<String> exclude;
  private final List<String> follow;
  private final String format;
  private final boolean forConcreteModel;
  private final List<ChangeEvent> events;
  private final List<ChangeEvent> eagerEvents;
  private final Set<String> eagerEventNames;

  public VersionAdapter(EntityModel<T> model, AdapterOptions options, SerializationCodec codec) {
    this.model = Objects.requireNonNull(model, "model");
    this.codec = Objects.requireNonNull(codec, "codec");
    Objects.requireNonNull(options, "options");
    this.fields = options.fields();
    this.exclude = options.exclude() == null ? List.of() : options.exclude();
    this.follow = options.follow() == null ? List.of() : options.follow();
    this.format = options.format() == null ? JsonSerializationCodec.FORMAT : options.format();
    this.forConcreteModel = options.forConcreteModel() == null || options.forConcreteModel();
    this.events = options.events() == null ? List.of(StandardChangeEvent.POST_SAVE) : options.events();
    this.eagerEvents = options.eagerEvents() == null ? List.of() : options.eagerEvents();
    Set<String> names = new LinkedHashSet<>();
    for (ChangeEvent event : eagerEvents) {
      names.add(event.name());
    }
    this.eagerEventNames = Set.copyOf(names);
    validate();
  }

  private void validate() {
    List<String> declared = new ArrayList<>(exclude);
    if (fields != null) {
      declared.addAll(fields);
    }
    for (String field : declared) {
      if (!model.hasField(field)) {
        throw new RegistrationException(model.label() + " has no field '" + field + "'");
      }
    }
    for (String relation : follow) {
      if (!model.hasRelation(relation)) {
        throw new RegistrationException("Cannot follow the relationship '" + relation
            + "': " + model.label() + " does not declare it");
      }
    }
    if (!codec.supports(format)) {
      throw new RegistrationException("Serialization format '" + format + "' is not supported by "
          + codec.getClass().getName());
    }
  }

  public EntityModel<T> getModel() {
    return model;
  }

  /**
   * Returns the field names to serialize: the explicit field list, or all model
   * fields, minus the excluded ones.
   */
  public List<String> getFieldsToSerialize() {
    List<String> candidates = fields == null ? model.fieldNames() : fields;
    List<String> result = new ArrayList<>(candidates.size());
    for (String field : candidates) {
      if (!exclude.contains(field)) {
        result.add(field);
      }
    }
    return result;
  }

  public List<String> getFollow() {
    return follow;
  }

  /**
   * Returns the entities reachable from {@code entity} through the followed
   * relations, one level deep.
   *
   * <p>A relation whose target no longer exists contributes nothing.
   *
   * @throws RegistrationException if a relation yields a {@code null} element
   */
  public List<Object> getFollowedRelations(T entity) {
    List<Object> related = new ArrayList<>();
    for (String relation : follow) {
      Related resolved;
      try {
        resolved = model.relation(entity, relation);
      } catch (ObjectMissingException e) {
        logger.log(Level.FINE, "Skipping missing relation " + model.label() + "." + relation, e);
        continue;
      }
      if (resolved instanceof Related.Single single) {
        related.add(single.entity());
      } else if (resolved instanceof Related.Many many) {
        for (Object item : many.entities()) {
          if (item == null) {
            throw new RegistrationException("Cannot follow the relationship '" + relation
                + "' of " + model.label() + ": it yielded a null element");
          }
          related.add(item);
        }
      }
    }
    return related;
  }

  public String getSerializationFormat() {
    return format;
  }

  public boolean isForConcreteModel() {
    return forConcreteModel;
  }

  /**
   * Events that capture the entity when the outermost scope closes.
   */
  public List<ChangeEvent> getEvents() {
    return events;
  }

  /**
   * Events that serialize the entity at the moment they fire.
   */
  public List<ChangeEvent> getEagerEvents() {
    return eagerEvents;
  }

  /**
   * Returns whether {@code event} is one of the eager events.
   */
  public boolean isEager(ChangeEvent event) {
    return eagerEventNames.contains(event.name());
  }

  /**
   * Returns the deferred events followed by the eager events.
   */
  public List<ChangeEvent> getAllEvents() {
    List<ChangeEvent> all = new ArrayList<>(events.size() + eagerEvents.size());
    all.addAll(events);
    all.addAll(eagerEvents);
    return all;
  }

  /**
   * Serializes {@link #getFieldsToSerialize()} of the entity with the codec.
   */
  public String getSerializedData(T entity) {
    return codec.serialize(format, model, entity, getFieldsToSerialize());
  }

  /**
   * Returns the identity key of the entity. Proxies resolve to their concrete
   * model unless {@link #isForConcreteModel()} is {@code false}.
   *
   * @throws IllegalArgumentException if the entity has never been persisted
   */
  public VersionId getVersionId(T entity) {
    EntityModel<?> opts = forConcreteModel ? model.concreteModel() : model;
    Object id = model.id(entity);
    if (id == null) {
      throw new IllegalArgumentException("Cannot identify unsaved " + model.label() + " entity");
    }
    return new VersionId(opts.appLabel(), opts.modelName(), id.toString());
  }

  /**
   * Returns the key the entity is captured under in a revision. Entities that
   * were never persisted share {@link VersionId#unsaved} of their model, so the
   * latest such capture replaces the earlier ones.
   */
  public VersionId getCaptureId(T entity) {
    if (model.id(entity) != null) {
      return getVersionId(entity);
    }
    EntityModel<?> opts = forConcreteModel ? model.concreteModel() : model;
    return VersionId.unsaved(opts.appLabel(), opts.modelName());
  }

  /**
   * Serializes the entity now, for storage when the revision is emitted.
   *
   * @param entity   the persisted entity
   * @param resource the resource the entity is stored in
   */
  public VersionData getVersionData(T entity, String resource) {
    return new VersionData(
        getVersionId(entity),
        resource,
        format,
        getSerializedData(entity),
        String.valueOf(entity));
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + model.label() + "]";
  }
}
