/**
 * Domain model for the validation engine.
 * <p><strong>Role:</strong> Pure value types and helpers with no I/O and no framework dependencies.</p>
 */
package ca.gc.cra.vigil.domain;
