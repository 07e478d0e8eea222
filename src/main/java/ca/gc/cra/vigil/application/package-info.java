/**
 * Application layer: the validator template, the master dispatch, the static facade and use cases.
 * <p><strong>Concurrency:</strong> Validators are stateless; the dispatch is immutable after construction.</p>
 */
package ca.gc.cra.vigil.application;
