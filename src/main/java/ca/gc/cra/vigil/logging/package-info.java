/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and sanitize validated values before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.</p>
 * <p><strong>Security:</strong> Provides masking so identifiers never reach logs in clear.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.vigil.logging;
