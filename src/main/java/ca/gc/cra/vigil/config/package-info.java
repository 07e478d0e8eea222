/**
 * Configuration layer: YAML validation profiles, CLI/YAML precedence and option parsing.
 * <p><strong>Error handling:</strong> Malformed or contradictory options raise
 * {@link java.lang.IllegalArgumentException}; the CLI maps them to exit codes.</p>
 */
package ca.gc.cra.vigil.config;
