package revision;

import revision.model.EntityModel;
import revision.spi.SerializationCodec;

/**
 * Creates the {@link VersionAdapter} for a model at registration time.
 *
 * <p>The default factory is {@code VersionAdapter::new}. Register a subclass'
 * constructor reference to customise behaviour beyond {@link AdapterOptions}.
 *
 * @param <T> the entity type
 */
@FunctionalInterface
public interface AdapterFactory<T> {

  VersionAdapter<T> create(EntityModel<T> model, AdapterOptions options, SerializationCodec codec);
}
