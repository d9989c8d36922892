/**
 * Entity metadata consumed by the revision core.
 *
 * <p>{@link revision.model.EntityModel} tells adapters how to read identity, fields and
 * relations of one entity type. {@link revision.model.Related} is the three-way result of
 * resolving a relation, and {@link revision.model.VersionId} is the key under which a
 * captured entity is stored inside a revision.
 */
package revision.model;
