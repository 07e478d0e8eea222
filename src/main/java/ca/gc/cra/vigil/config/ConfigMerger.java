package ca.gc.cra.vigil.config;

import ca.gc.cra.vigil.domain.validation.ValidationConfig;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges validation options from a YAML profile and the command line while enforcing precedence and
 * cross-field invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective option map using precedence CLI &gt; YAML.
   *
   * @param yaml optional options loaded from a YAML profile
   * @param cli CLI key/value options (may be empty or {@code null})
   * @param warn consumer invoked when a CLI key overrides a YAML key; may be {@code null}
   * @return immutable merged option map
   * @throws IllegalArgumentException when an option is malformed or options contradict each other
   */
  public static Map<String, String> buildEffectiveOptions(
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      String value = entry.getValue();
      if (key == null || value == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, value);
    }

    validate(ValidationConfigs.fromMap(merged));
    return Map.copyOf(merged);
  }

  /**
   * Merges both sources and returns the typed configuration.
   *
   * @param yaml optional options loaded from a YAML profile
   * @param cli CLI key/value options (may be empty or {@code null})
   * @param warn consumer invoked when a CLI key overrides a YAML key; may be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException when an option is malformed or options contradict each other
   */
  public static ValidationConfig merge(
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Consumer<String> warn) {
    return ValidationConfigs.fromMap(buildEffectiveOptions(yaml, cli, warn));
  }

  /**
   * Checks cross-field invariants of a configuration.
   *
   * @param config configuration to check; must not be {@code null}
   * @throws IllegalArgumentException when bounds contradict each other
   */
  public static void validate(ValidationConfig config) {
    if (config.min().isPresent() && config.max().isPresent()
        && config.min().getAsDouble() > config.max().getAsDouble()) {
      throw new IllegalArgumentException("min must be <= max");
    }
    if (config.minLength().isPresent() && config.maxLength().isPresent()
        && config.minLength().getAsInt() > config.maxLength().getAsInt()) {
      throw new IllegalArgumentException("minLength must be <= maxLength");
    }
    if (config.fixLength().isPresent()) {
      int fixLength = config.fixLength().getAsInt();
      if (config.minLength().isPresent() && fixLength < config.minLength().getAsInt()) {
        throw new IllegalArgumentException("fixLength must be >= minLength");
      }
      if (config.maxLength().isPresent() && fixLength > config.maxLength().getAsInt()) {
        throw new IllegalArgumentException("fixLength must be <= maxLength");
      }
    }
  }
}
