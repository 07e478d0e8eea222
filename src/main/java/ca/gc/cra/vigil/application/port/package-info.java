/**
 * Application ports for validators and the time source.
 * <p><strong>Role:</strong> Seams between the dispatch, the batch use case and validator implementations.</p>
 * <p><strong>Concurrency:</strong> Implementations must be thread-safe.</p>
 */
package ca.gc.cra.vigil.application.port;
