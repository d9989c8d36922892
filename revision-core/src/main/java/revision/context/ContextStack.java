package revision.context;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Open frames of one thread, the resource each was opened for, and the number
 * of open scopes per resource.
 */
final class ContextStack {
  final Deque<ContextFrame> frames = new ArrayDeque<>();
  final Deque<String> resources = new ArrayDeque<>();
  final Map<String, Integer> depths = new HashMap<>();

  boolean isEmpty() {
    return frames.isEmpty();
  }

  ContextFrame current() {
    return frames.peek();
  }

  /**
   * Returns the resource of the innermost open scope.
   */
  String currentResource() {
    return resources.peek();
  }

  void push(ContextFrame frame, String resource) {
    frames.push(frame);
    resources.push(resource);
    depths.merge(resource, 1, Integer::sum);
  }

  ContextFrame pop() {
    resources.pop();
    return frames.pop();
  }

  /**
   * Decrements the open count of {@code resource}.
   *
   * @return the remaining count
   */
  int release(String resource) {
    int remaining = depths.getOrDefault(resource, 0) - 1;
    if (remaining <= 0) {
      depths.remove(resource);
    } else {
      depths.put(resource, remaining);
    }
    return remaining;
  }

  boolean isOpen(String resource) {
    return depths.containsKey(resource);
  }
}
