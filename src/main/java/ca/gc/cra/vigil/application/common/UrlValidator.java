package ca.gc.cra.vigil.application.common;

import ca.gc.cra.vigil.application.AbstractValidator;
import ca.gc.cra.vigil.domain.util.Whitespace;
import ca.gc.cra.vigil.domain.validation.InputValue;
import ca.gc.cra.vigil.domain.validation.ValidationConfig;
import ca.gc.cra.vigil.domain.validation.ValidationResult;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validates absolute http, https and ftp URLs.
 * <p><strong>Rules:</strong> at most 2048 characters; the value must parse as an absolute URI with a server
 * authority (with {@code https://} assumed when no scheme separator is present), a valid host and a port
 * of at most 65535, and match a strict host pattern: dotted domain with an alphabetic top-level domain,
 * {@code localhost}, or a dotted quad, with optional port and path.</p>
 * <p>Characters that browsers percent-encode in paths, such as the pipe and double quote, are encoded
 * before parsing so they do not fail the authority parse.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * <p>The normalized value is the trimmed input, without the assumed scheme.</p>
 *
 * @since 0.1.0
 */
public final class UrlValidator extends AbstractValidator {
  static final int MAX_LENGTH = 2048;
  static final int MAX_PORT = 65535;

  private static final String PATH_UNSAFE = "\"<>\\^`{|}[] ";

  private static final Pattern URL_PATTERN = Pattern.compile(
      "(?:(?:https?|ftp)://)?"
          + "(?:(?:[a-zA-Z0-9](?:[a-zA-Z0-9-]*[a-zA-Z0-9])?\\.)+[a-zA-Z]{2,}|localhost|\\d{1,3}(?:\\.\\d{1,3}){3})"
          + "(?::\\d+)?"
          + "(?:/\\S*)?");

  /** Creates the validator. */
  public UrlValidator() {
    super("URL", "URL is required");
  }

  @Override
  protected ValidationResult check(InputValue value, ValidationConfig config) {
    String url = Whitespace.trim(value.asText());
    if (url.length() > MAX_LENGTH) {
      return ValidationResult.failure("URL is too long (max 2048 characters)", config);
    }
    if (!parses(url.contains("://") ? url : "https://" + url) || !URL_PATTERN.matcher(url).matches()) {
      return ValidationResult.failure("Invalid URL format", config);
    }
    return ValidationResult.success(url);
  }

  private static boolean parses(String candidate) {
    try {
      URI uri = new URI(encodeAfterAuthority(candidate)).parseServerAuthority();
      return uri.getHost() != null && uri.getPort() <= MAX_PORT;
    } catch (URISyntaxException ex) {
      return false;
    }
  }

  /**
   * Percent-encodes the characters after the authority that {@link URI} rejects but browsers encode.
   *
   * @param candidate URL text containing {@code ://}
   * @return text with the same authority and an encoded path, query and fragment
   */
  static String encodeAfterAuthority(String candidate) {
    int tailStart = candidate.indexOf("://") + 3;
    while (tailStart < candidate.length() && "/?#".indexOf(candidate.charAt(tailStart)) < 0) {
      tailStart++;
    }
    StringBuilder out = new StringBuilder(candidate.length() + 16).append(candidate, 0, tailStart);
    boolean inFragment = false;
    for (int i = tailStart; i < candidate.length(); i++) {
      char c = candidate.charAt(i);
      if (c == '#' && !inFragment) {
        inFragment = true;
        out.append(c);
      } else if (c == '#' || PATH_UNSAFE.indexOf(c) >= 0 || Character.isISOControl(c)
          || Character.isSpaceChar(c) || (c == '%' && !isEscape(candidate, i))) {
        for (byte b : String.valueOf(c).getBytes(StandardCharsets.UTF_8)) {
          out.append('%').append(String.format("%02X", b & 0xFF));
        }
      } else {
        out.append(c);
      }
    }
    return out.toString();
  }

  private static boolean isEscape(String text, int index) {
    return index + 2 < text.length()
        && Character.digit(text.charAt(index + 1), 16) >= 0
        && Character.digit(text.charAt(index + 2), 16) >= 0;
  }
}
