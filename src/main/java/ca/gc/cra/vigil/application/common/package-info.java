/**
 * Validators for common form data: numbers, text, email, URL, phone numbers, dates and ages.
 * <p><strong>Role:</strong> Implementations of {@link ca.gc.cra.vigil.application.port.Validator} selected by
 * the master dispatch.</p>
 * <p><strong>Concurrency:</strong> Validators are stateless; safe to share.</p>
 */
package ca.gc.cra.vigil.application.common;
