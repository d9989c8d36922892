package revision.model;

import java.util.Objects;

/**
 * Identity key of a captured entity: the model it is stored under plus its
 * primary key rendered as text.
 *
 * <p>Within one manager's object set a {@code VersionId} identifies exactly one
 * entity, so capturing the same entity twice replaces the earlier capture.
 */
public record VersionId(String appLabel, String modelName, String objectId) {

  /** Object id shared by every entity of a model that has not been persisted yet. */
  public static final String UNSAVED = "";

  public VersionId {
    Objects.requireNonNull(appLabel, "appLabel");
    Objects.requireNonNull(modelName, "modelName");
    Objects.requireNonNull(objectId, "objectId");
  }

  /**
   * Returns the key under which unsaved entities of a model are captured.
   */
  public static VersionId unsaved(String appLabel, String modelName) {
    return new VersionId(appLabel, modelName, UNSAVED);
  }

  public boolean isUnsaved() {
    return UNSAVED.equals(objectId);
  }

  /**
   * Returns {@code appLabel.modelName}.
   */
  public String label() {
    return appLabel + "." + modelName;
  }

  @Override
  public String toString() {
    return label() + "#" + objectId;
  }
}
