/**
 * Validators for GS1 logistics keys (GLN, GTIN, SSCC) and their shared Modulo-10 engine.
 */
package ca.gc.cra.vigil.application.logistics;
