package revision;

/**
 * A unit of work run inside a revision scope.
 *
 * @param <V> the result type
 * @param <E> the checked exception the work may throw
 * @see RevisionScope#execute(RevisionWork)
 */
@FunctionalInterface
public interface RevisionWork<V, E extends Exception> {

  V execute() throws E;
}
