/**
 * Validators for financial identifiers (IBAN, ISIN).
 * <p><strong>Security:</strong> Account numbers are personal data; log them through
 * {@code ca.gc.cra.vigil.logging.Logs#mask} only.</p>
 */
package ca.gc.cra.vigil.application.finance;
