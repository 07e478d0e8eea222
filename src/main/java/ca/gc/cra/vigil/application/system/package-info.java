/**
 * Validators for system identifiers such as cross-platform file names.
 */
package ca.gc.cra.vigil.application.system;
