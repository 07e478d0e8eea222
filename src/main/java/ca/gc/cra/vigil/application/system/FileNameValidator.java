package ca.gc.cra.vigil.application.system;

import ca.gc.cra.vigil.application.AbstractValidator;
import ca.gc.cra.vigil.domain.util.Whitespace;
import ca.gc.cra.vigil.domain.validation.InputValue;
import ca.gc.cra.vigil.domain.validation.ValidationConfig;
import ca.gc.cra.vigil.domain.validation.ValidationResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validates file names that are safe on Windows, macOS and Linux.
 * <p><strong>Rules:</strong> non-blank after trimming; {@code maxLength} (default 255) and {@code minLength};
 * none of {@code < > : " / \ | ? *}; no control characters; no trailing space or dot; not a reserved Windows
 * device name; an accepted extension when {@code acceptedFileExtensions} is configured.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class FileNameValidator extends AbstractValidator {
  /** Length limit applied when {@code maxLength} is not configured. */
  public static final int DEFAULT_MAX_LENGTH = 255;

  private static final Pattern FORBIDDEN = Pattern.compile("[<>:\"/\\\\|?*]");
  private static final Pattern CONTROL = Pattern.compile("[\\x00-\\x1F]");
  private static final Set<String> RESERVED_NAMES = Set.of(
      "CON", "PRN", "AUX", "NUL",
      "COM1", "COM2", "COM3", "COM4", "COM5", "COM6", "COM7", "COM8", "COM9",
      "LPT1", "LPT2", "LPT3", "LPT4", "LPT5", "LPT6", "LPT7", "LPT8", "LPT9");

  /** Creates the validator. */
  public FileNameValidator() {
    super("file name", "File name is required");
  }

  @Override
  protected ValidationResult check(InputValue value, ValidationConfig config) {
    String fileName = Whitespace.trim(value.asText());
    if (fileName.isEmpty()) {
      return ValidationResult.failure("File name cannot be empty or only whitespace", config);
    }
    int maxLength = config.maxLength().orElse(DEFAULT_MAX_LENGTH);
    if (fileName.length() > maxLength) {
      return ValidationResult.failure("File name too long (max " + maxLength + " characters)", config);
    }
    if (config.minLength().isPresent() && fileName.length() < config.minLength().getAsInt()) {
      return ValidationResult.failure(
          "File name too short (min " + config.minLength().getAsInt() + " characters)", config);
    }
    Matcher forbidden = FORBIDDEN.matcher(fileName);
    if (forbidden.find()) {
      return ValidationResult.failure("File name contains forbidden character: " + forbidden.group(), config);
    }
    if (CONTROL.matcher(fileName).find()) {
      return ValidationResult.failure("File name contains control characters", config);
    }
    if (fileName.endsWith(" ") || fileName.endsWith(".")) {
      return ValidationResult.failure("File name cannot end with a space or dot", config);
    }
    int firstDot = fileName.indexOf('.');
    String baseName = firstDot < 0 ? fileName : fileName.substring(0, firstDot);
    if (RESERVED_NAMES.contains(baseName.toUpperCase(Locale.ROOT))) {
      return ValidationResult.failure("File name uses reserved Windows name: " + baseName, config);
    }
    List<String> accepted = normalizeExtensions(config.acceptedFileExtensions());
    if (!accepted.isEmpty()) {
      int lastDot = fileName.lastIndexOf('.');
      String extension = lastDot < 0 ? "" : fileName.substring(lastDot).toLowerCase(Locale.ROOT);
      if (!accepted.contains(extension)) {
        return ValidationResult.failure(
            "File extension not allowed. Accepted: " + String.join(", ", accepted), config);
      }
    }
    return ValidationResult.success(fileName);
  }

  static List<String> normalizeExtensions(List<String> extensions) {
    List<String> normalized = new ArrayList<>(extensions.size());
    for (String extension : extensions) {
      String lower = extension.toLowerCase(Locale.ROOT);
      normalized.add(lower.startsWith(".") ? lower : "." + lower);
    }
    return normalized;
  }
}
