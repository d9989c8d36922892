/**
 * Service provider interfaces for the collaborators around the revision core:
 * the transactional resource ({@link revision.spi.TransactionSupport}), the
 * snapshot codec ({@link revision.spi.SerializationCodec}) and metrics
 * ({@link revision.spi.RevisionMetrics}).
 */
package revision.spi;
