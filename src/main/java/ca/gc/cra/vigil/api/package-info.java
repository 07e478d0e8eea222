/**
 * Command-line adapters: the {@code vigil} dispatcher and its {@code validate} and {@code batch} commands.
 * <p><strong>Output:</strong> Results go to stdout through {@link ca.gc.cra.vigil.api.CliPrinter}; diagnostics
 * go to the log on stderr.</p>
 * <p><strong>Error handling:</strong> Failures are logged and mapped to {@link ca.gc.cra.vigil.api.ExitCode}.</p>
 */
package ca.gc.cra.vigil.api;
