package revision.spi;

import revision.model.EntityModel;

import java.util.List;

/**
 * Turns an entity into the opaque payload stored with a version.
 *
 * @see revision.codec.JsonSerializationCodec
 */
public interface SerializationCodec {

  /**
   * Returns whether this codec can produce the named format.
   */
  boolean supports(String format);

  /**
   * Serializes the listed fields of {@code entity}.
   *
   * @param format the format name, one for which {@link #supports} is true
   * @param model  the model describing the entity
   * @param entity the entity
   * @param fields field names to include, in order
   * @param <T>    the entity type
   * @return the serialized payload
   * @throws IllegalArgumentException if the format is not supported
   */
  <T> String serialize(String format, EntityModel<T> model, T entity, List<String> fields);
}
