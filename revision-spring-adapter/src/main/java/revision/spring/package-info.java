/**
 * Spring transaction integration for revision scopes.
 *
 * <p>{@link revision.spring.SpringTransactionSupport} runs every revision block in a
 * nested Spring transaction, so revisions are emitted inside the same transaction as
 * the changes made through {@code JdbcTemplate} or other Spring-managed resources.
 *
 * @see revision.spring.SpringTransactionSupport
 */
package revision.spring;
