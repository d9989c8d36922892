/**
 * Root API for nested, transactional revision capture.
 *
 * <h2>Core Design</h2>
 * <p>Code marks a block as a {@linkplain revision.RevisionScope revision scope}. Change
 * events fired for registered entities inside the block are captured by the
 * {@linkplain revision.registry.RevisionManager manager} the entity's model is registered
 * with, into the current frame of the thread's
 * {@linkplain revision.context.RevisionContextManager context stack}. Scopes nest: an
 * inner scope works on a copy of its parent's revision state and hands it back only if
 * it succeeds, so a failing inner block never leaks into the outer revision. When the
 * outermost scope of a transactional resource closes cleanly, every manager with
 * captures publishes one {@link revision.Revision} to its
 * {@linkplain revision.RevisionListener listeners}, inside the transaction and before it
 * commits.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>revision-core</b>: models, adapters, context stack, managers, SPIs</li>
 *   <li><b>revision-jdbc</b>: savepoint-based JDBC {@link revision.spi.TransactionSupport}</li>
 *   <li><b>revision-spring-adapter</b>: Spring-managed {@link revision.spi.TransactionSupport}</li>
 *   <li><b>revision-micrometer</b>: Micrometer {@link revision.spi.RevisionMetrics}</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * EntityModel<Order> orders = EntityModel.builder(Order.class, "shop", "order")
 *     .id(Order::getId)
 *     .field("reference", Order::getReference)
 *     .build();
 *
 * DefaultChangeEventDispatcher changes = new DefaultChangeEventDispatcher();
 * Revisions revisions = Revisions.builder()
 *     .dispatcher(changes)
 *     .revisionListener(revision -> store.save(revision))
 *     .build();
 * revisions.register(orders);
 *
 * revisions.createRevision().execute(() -> {
 *   revisions.setComment("Created order");
 *   changes.fire(StandardChangeEvent.POST_SAVE, orderRepository.save(order));
 *   return null;
 * });
 * }</pre>
 */
package revision;
