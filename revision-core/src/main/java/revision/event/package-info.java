/**
 * Change events and their dispatch.
 *
 * <p>A {@link revision.event.ChangeEventDispatcher} delivers
 * {@link revision.event.ChangeEvent}s to {@link revision.event.ChangeReceiver}s keyed by
 * entity class and event name. {@link revision.event.DefaultChangeEventDispatcher} is
 * the in-memory implementation persistence code fires into.
 *
 * @see revision.registry.RevisionManager
 */
package revision.event;
