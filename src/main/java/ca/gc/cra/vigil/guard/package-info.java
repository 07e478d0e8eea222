/**
 * Argument guards shared by the configuration and CLI layers.
 * <p><strong>Role:</strong> Fail-fast checks that throw {@link java.lang.IllegalArgumentException} with
 * {@code "<name> must ..."} messages.</p>
 * <p><strong>Concurrency:</strong> Stateless utilities; safe to call concurrently.</p>
 */
package ca.gc.cra.vigil.guard;
