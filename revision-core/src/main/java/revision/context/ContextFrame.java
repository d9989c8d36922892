package revision.context;

import revision.model.VersionId;
import revision.registry.RevisionManager;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Capture state of one nesting level.
 *
 * <p>{@code manageManually} and {@code invalid} belong to the block and never
 * flow between frames. Everything else belongs to the revision: a child frame
 * starts from a copy of it and hands its final values back on {@link #join}.
 */
final class ContextFrame {
  // Block-scoped.
  final boolean manageManually;
  boolean invalid;
  // Revision-scoped.
  Object user;
  String comment;
  boolean ignoreDuplicates;
  Map<RevisionManager, Map<VersionId, Capture>> managerObjects;
  List<Object> meta;

  private ContextFrame(boolean manageManually, Object user, String comment, boolean ignoreDuplicates,
      Map<RevisionManager, Map<VersionId, Capture>> managerObjects, List<Object> meta) {
    this.manageManually = manageManually;
    this.user = user;
    this.comment = comment;
    this.ignoreDuplicates = ignoreDuplicates;
    this.managerObjects = managerObjects;
    this.meta = meta;
  }

  /**
   * Frame of an outermost scope: no user, empty comment, nothing captured.
   */
  static ContextFrame root(boolean manageManually) {
    return new ContextFrame(manageManually, null, "", false, new LinkedHashMap<>(), new ArrayList<>());
  }

  /**
   * Frame for a scope nested in this one. Object sets and meta are copied so the
   * child cannot change this frame until it is joined.
   */
  ContextFrame fork(boolean manageManually) {
    Map<RevisionManager, Map<VersionId, Capture>> objects = new LinkedHashMap<>();
    for (Map.Entry<RevisionManager, Map<VersionId, Capture>> entry : managerObjects.entrySet()) {
      objects.put(entry.getKey(), new LinkedHashMap<>(entry.getValue()));
    }
    return new ContextFrame(manageManually, user, comment, ignoreDuplicates, objects, new ArrayList<>(meta));
  }

  /**
   * Adopts the revision-scoped state of a closed child frame, unless the child
   * was invalidated.
   */
  void join(ContextFrame child) {
    if (child.invalid) {
      return;
    }
    user = child.user;
    comment = child.comment;
    ignoreDuplicates = child.ignoreDuplicates;
    managerObjects = child.managerObjects;
    meta = child.meta;
  }

  Map<VersionId, Capture> objectsFor(RevisionManager manager) {
    return managerObjects.computeIfAbsent(manager, ignored -> new LinkedHashMap<>());
  }
}
