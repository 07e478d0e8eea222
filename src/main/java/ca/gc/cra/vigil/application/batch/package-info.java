/**
 * Batch validation of line-oriented sources.
 * <p><strong>Role:</strong> Application use case behind the {@code batch} CLI command.</p>
 * <p><strong>Concurrency:</strong> Single-threaded per run; readers are owned by the caller or closed by the
 * use case when it opened them.</p>
 */
package ca.gc.cra.vigil.application.batch;
