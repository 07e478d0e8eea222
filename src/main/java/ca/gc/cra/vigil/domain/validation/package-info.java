/**
 * Validation contract shared by every validator: input kinds, per-call options and results.
 * <p><strong>Role:</strong> Domain value objects passed from callers through the dispatch to validators.</p>
 * <p><strong>Concurrency:</strong> All types are immutable; safe for sharing across threads.</p>
 * <p><strong>Security:</strong> Raw input values may carry personal data; mask them before logging.</p>
 */
package ca.gc.cra.vigil.domain.validation;
