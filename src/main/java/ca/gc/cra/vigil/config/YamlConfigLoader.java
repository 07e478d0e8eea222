package ca.gc.cra.vigil.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads validation profiles from a YAML document and flattens them into option key/value maps.
 *
 * <p>The document root maps {@code common} and profile names to option mappings. Nested mappings flatten to
 * dotted keys ({@code decimals: {max: 2}} becomes {@code decimals.max}); sequences join with commas.</p>
 *
 * <pre>
 * common:
 *   customErrorMessage: ""
 * amount:
 *   min: 0
 *   decimals:
 *     max: 2
 * upload:
 *   acceptedFileExtensions: [pdf, .png]
 * </pre>
 */
public final class YamlConfigLoader {
  static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and merges the {@code common} section with the requested profile section.
   *
   * @param path location of the YAML document
   * @param profile profile name, matched ignoring case; {@code null} loads the {@code common} section only
   * @return flat option map, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid or the profile is missing
   */
  public static Optional<Map<String, String>> load(Path path, String profile) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        if (profile != null) {
          throw new IllegalArgumentException("profile " + profile + " not found in " + path);
        }
        return Optional.of(Map.of());
      }
      Map<String, Object> root = asMap(document, "root");

      Map<String, String> flattened = new LinkedHashMap<>();
      Object commonSection = findSection(root, COMMON_SECTION);
      if (commonSection != null) {
        flatten(asMap(commonSection, COMMON_SECTION), "", flattened);
      }
      if (profile != null) {
        String normalizedProfile = profile.trim().toLowerCase(Locale.ROOT);
        Object profileSection = findSection(root, normalizedProfile);
        if (profileSection == null) {
          throw new IllegalArgumentException("profile " + profile + " not found in " + path);
        }
        flatten(asMap(profileSection, normalizedProfile), "", flattened);
      }

      return Optional.of(Map.copyOf(flattened));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?> items) {
        target.put(composite, join(items, composite));
      } else if (value instanceof Date date) {
        // Unquoted YAML timestamps arrive as java.util.Date in UTC.
        target.put(composite, date.toInstant().toString());
      } else {
        target.put(composite, value.toString());
      }
    }
  }

  private static String join(Iterable<?> items, String key) {
    StringBuilder joined = new StringBuilder();
    for (Object item : items) {
      if (item instanceof Map<?, ?> || item instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML list for key " + key + " must contain scalars only");
      }
      if (joined.length() > 0) {
        joined.append(',');
      }
      joined.append(item == null ? "" : item.toString());
    }
    return joined.toString();
  }
}
