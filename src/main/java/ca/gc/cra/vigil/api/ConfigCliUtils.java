package ca.gc.cra.vigil.api;

import ca.gc.cra.vigil.config.ConfigMerger;
import ca.gc.cra.vigil.config.ValidationConfigs;
import ca.gc.cra.vigil.config.YamlConfigLoader;
import ca.gc.cra.vigil.domain.validation.ValidationConfig;
import ca.gc.cra.vigil.guard.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared helpers resolving the effective {@link ValidationConfig} from CLI options and an optional YAML
 * profile.
 */
final class ConfigCliUtils {
  private static final Logger log = LoggerFactory.getLogger(ConfigCliUtils.class);

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Removes {@code config} and {@code profile} from {@code options}, loads the profile and merges it with the
   * remaining options. Failures are logged and mapped to an exit code.
   *
   * @param options CLI options left after command-specific keys were removed; mutated
   * @return resolved configuration or the exit code to report
   */
  static Resolution resolve(Map<String, String> options) {
    String configPath = extractConfigPath(options);
    String profile = options.remove("profile");
    if (profile != null && profile.isBlank()) {
      profile = null;
    }
    if (profile != null && configPath == null) {
      log.error("profile={} requires config=FILE", profile);
      return Resolution.failed(ExitCode.INVALID_ARGS);
    }

    try {
      ValidationConfigs.fromMap(options);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid option: {}", ex.getMessage());
      return Resolution.failed(ExitCode.INVALID_ARGS);
    }

    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      try {
        Path path = Paths.requireReadableFile("config", Path.of(configPath));
        yaml = YamlConfigLoader.load(path, profile);
        log.debug("Loaded {} options from {} (profile {})",
            yaml.map(Map::size).orElse(0), path, profile == null ? "<common>" : profile);
      } catch (IOException ex) {
        log.error("Unable to read config file {}", configPath, ex);
        return Resolution.failed(ExitCode.IO_ERROR);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid config file: {}", ex.getMessage());
        return Resolution.failed(ExitCode.CONFIG_ERROR);
      }
    }

    try {
      return Resolution.of(ConfigMerger.merge(yaml, options, log::warn));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid validation configuration: {}", ex.getMessage());
      return Resolution.failed(ExitCode.CONFIG_ERROR);
    }
  }

  record Resolution(ValidationConfig config, ExitCode failure) {
    static Resolution of(ValidationConfig config) {
      return new Resolution(config, null);
    }

    static Resolution failed(ExitCode failure) {
      return new Resolution(null, failure);
    }

    boolean ok() {
      return failure == null;
    }
  }
}
