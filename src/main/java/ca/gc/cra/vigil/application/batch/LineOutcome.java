package ca.gc.cra.vigil.application.batch;

import ca.gc.cra.vigil.domain.validation.ValidationResult;

/**
 * Result of validating one line of a batch source.
 *
 * @param lineNumber one-based line number
 * @param input line content as read, without the line terminator
 * @param result validation outcome; never {@code null}
 * @since 0.1.0
 */
public record LineOutcome(long lineNumber, String input, ValidationResult result) {}
