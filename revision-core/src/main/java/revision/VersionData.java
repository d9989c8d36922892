package revision;

import revision.model.VersionId;

import java.util.Objects;

/**
 * An entity serialized at capture time, for entities that may be gone by the
 * time the revision is emitted.
 *
 * @param versionId      identity of the entity
 * @param resource       transactional resource the entity is stored in
 * @param format         serialization format of {@code serializedData}
 * @param serializedData the codec output
 * @param objectRepr     human-readable form of the entity
 */
public record VersionData(
    VersionId versionId, String resource, String format, String serializedData, String objectRepr) {

  public VersionData {
    Objects.requireNonNull(versionId, "versionId");
    Objects.requireNonNull(resource, "resource");
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(serializedData, "serializedData");
    Objects.requireNonNull(objectRepr, "objectRepr");
  }
}
