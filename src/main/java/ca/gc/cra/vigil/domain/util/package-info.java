/**
 * Domain utility classes for identifier sanitization, numeric coercion and date arithmetic.
 * <p><strong>Role:</strong> Domain support functions reused by every validator family.</p>
 * <p><strong>Concurrency:</strong> Utilities are stateless; safe to call concurrently.</p>
 * <p><strong>Metrics:</strong> Do not emit metrics or logs; callers observe usage.</p>
 */
package ca.gc.cra.vigil.domain.util;
