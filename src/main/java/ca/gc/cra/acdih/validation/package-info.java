/**
 * <strong>Purpose:</strong> Validation helpers used during configuration bootstrap and CLI parsing.
 * <p><strong>Role:</strong> Ensures invalid settings are rejected before consumers open connections to the
 * document database or cache.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 * <p><strong>Security:</strong> Enforces printable ASCII constraints to avoid control character injection in
 * endpoints and identifiers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.acdih.validation;
