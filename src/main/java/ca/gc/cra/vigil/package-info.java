/**
 * VIGIL: pure validation functions for common, financial, logistics and system identifiers.
 */
package ca.gc.cra.vigil;
