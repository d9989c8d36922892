package revision;

import com.github.f4b6a3.ulid.UlidCreator;
import revision.registry.RevisionManager;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Everything one manager captured in an outermost revision scope, handed to its
 * {@link RevisionListener}s before the surrounding transaction commits.
 *
 * <p>Each revision is assigned a ULID-based {@code revisionId}. Live objects are
 * still attached entities that the listener serializes itself; serialized
 * objects were snapshotted by eager events when they fired.
 */
public final class Revision {
  private final String revisionId;
  private final Instant createdAt;
  private final RevisionManager manager;
  private final String resource;
  private final List<Object> objects;
  private final List<VersionData> serializedObjects;
  private final Object user;
  private final String comment;
  private final List<Object> meta;
  private final boolean ignoreDuplicates;

  public Revision(RevisionManager manager, String resource, List<Object> objects,
      List<VersionData> serializedObjects, Object user, String comment, List<Object> meta,
      boolean ignoreDuplicates) {
    this.revisionId = UlidCreator.getMonotonicUlid().toString();
    this.createdAt = Instant.now();
    this.manager = Objects.requireNonNull(manager, "manager");
    this.resource = Objects.requireNonNull(resource, "resource");
    this.objects = List.copyOf(objects);
    this.serializedObjects = List.copyOf(serializedObjects);
    this.user = user;
    this.comment = comment == null ? "" : comment;
    this.meta = List.copyOf(meta);
    this.ignoreDuplicates = ignoreDuplicates;
  }

  public String revisionId() {
    return revisionId;
  }

  public Instant createdAt() {
    return createdAt;
  }

  /**
   * The manager whose registered models produced the captures.
   */
  public RevisionManager manager() {
    return manager;
  }

  /**
   * Alias of the transactional resource the scope ran in.
   */
  public String resource() {
    return resource;
  }

  public List<Object> objects() {
    return objects;
  }

  public List<VersionData> serializedObjects() {
    return serializedObjects;
  }

  /**
   * Number of live plus serialized objects.
   */
  public int size() {
    return objects.size() + serializedObjects.size();
  }

  /**
   * The user set on the scope, or {@code null}.
   */
  public Object user() {
    return user;
  }

  public String comment() {
    return comment;
  }

  /**
   * Meta records in the order they were added.
   */
  public List<Object> meta() {
    return meta;
  }

  /**
   * Whether storage should skip this revision when it is identical to the
   * previous one. The core only carries the flag.
   */
  public boolean ignoreDuplicates() {
    return ignoreDuplicates;
  }

  @Override
  public String toString() {
    return "Revision{" + revisionId + ", manager=" + manager.slug() + ", resource=" + resource
        + ", objects=" + objects.size() + ", serialized=" + serializedObjects.size() + "}";
  }
}
