package ca.gc.cra.vigil.api;

import ca.gc.cra.vigil.domain.validation.InputType;
import ca.gc.cra.vigil.guard.Paths;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Command line of a VIGIL command: recognized flags, the command token and the
 * {@code key=value} options.
 * <p><strong>Why:</strong> The dispatcher and both subcommands share one flag vocabulary and the
 * {@code type=}, {@code value=} and {@code in=} arguments; resolving them here keeps their diagnostics
 * identical.</p>
 * <p><strong>Role:</strong> Adapter-side value parsed once from {@code String[]} and handed to the CLIs.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * <p>A token is a flag when it starts with {@code -} and has no {@code =}; {@code value=-5} stays an option.
 * Aliases are normalized: {@code -h} and {@code help} to {@code --help}, {@code -v} and {@code --debug} to
 * {@code --verbose}.</p>
 *
 * @since 0.1.0
 */
public final class CliInput {
  static final String TYPE = "type";
  static final String VALUE = "value";
  static final String IN = "in";
  static final String HELP_FLAG = "--help";
  static final String VERBOSE_FLAG = "--verbose";
  static final String JSON_FLAG = "--json";
  static final String SKIP_BLANK_FLAG = "--skip-blank";

  private static final Map<String, String> FLAG_ALIASES = Map.of(
      "-h", HELP_FLAG,
      "help", HELP_FLAG,
      "-v", VERBOSE_FLAG,
      "--debug", VERBOSE_FLAG);

  private final List<String> tokens;
  private final Set<String> flags;

  private CliInput(List<String> tokens, Set<String> flags) {
    this.tokens = List.copyOf(tokens);
    this.flags = Set.copyOf(flags);
  }

  /**
   * Splits raw arguments into flags and option tokens.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed command line
   */
  public static CliInput parse(String[] args) {
    List<String> tokens = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args == null) {
      return new CliInput(tokens, flags);
    }
    for (String raw : args) {
      if (raw == null) {
        continue;
      }
      String arg = raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (FLAG_ALIASES.containsKey(lower)) {
        flags.add(FLAG_ALIASES.get(lower));
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else {
        tokens.add(arg);
      }
    }
    return new CliInput(tokens, flags);
  }

  /** @return {@code true} when help output was requested */
  public boolean help() {
    return flags.contains(HELP_FLAG);
  }

  /** @return {@code true} when DEBUG logging was requested */
  public boolean verbose() {
    return flags.contains(VERBOSE_FLAG);
  }

  /** @return {@code true} when results should be printed as JSON */
  public boolean json() {
    return flags.contains(JSON_FLAG);
  }

  /** @return {@code true} when blank batch lines should be skipped */
  public boolean skipBlank() {
    return flags.contains(SKIP_BLANK_FLAG);
  }

  /**
   * Returns every normalized flag, including ones no command recognizes.
   *
   * @return immutable set of lowercase flags
   */
  public Set<String> flags() {
    return flags;
  }

  /**
   * Returns the first non-flag token, which the dispatcher reads as the subcommand name.
   *
   * @return command token, or empty when only flags were given
   */
  public Optional<String> command() {
    return tokens.isEmpty() ? Optional.empty() : Optional.of(tokens.get(0));
  }

  /**
   * Drops the command token, keeping every flag so a subcommand sees {@code --verbose} or {@code --help}
   * given before or after the command.
   *
   * @return command line forwarded to the subcommand
   */
  public CliInput withoutCommand() {
    return tokens.isEmpty() ? this : new CliInput(tokens.subList(1, tokens.size()), flags);
  }

  /**
   * Parses the option tokens into a mutable map in argument order.
   *
   * @return options keyed by name
   * @throws IllegalArgumentException when a token is not a well-formed {@code key=value} pair
   */
  public Map<String, String> options() {
    return CliArgsParser.toMap(tokens.toArray(String[]::new));
  }

  /**
   * Removes {@code type=} from the options and resolves its input type.
   *
   * @param options parsed options; mutated
   * @return requested input type
   * @throws IllegalArgumentException when the type is missing or not a registered tag
   */
  static InputType takeType(Map<String, String> options) {
    String tag = options.remove(TYPE);
    if (tag == null || tag.isBlank()) {
      throw new IllegalArgumentException("Missing required argument: " + TYPE);
    }
    return InputType.fromTag(tag)
        .orElseThrow(() -> new IllegalArgumentException("Unknown input type: " + tag));
  }

  /**
   * Removes {@code value=} from the options. An empty value is kept so the required rule can report it.
   *
   * @param options parsed options; mutated
   * @return raw value text
   * @throws IllegalArgumentException when the argument is absent
   */
  static String takeValue(Map<String, String> options) {
    if (!options.containsKey(VALUE)) {
      throw new IllegalArgumentException("Missing required argument: " + VALUE);
    }
    return options.remove(VALUE);
  }

  /**
   * Removes {@code in=} from the options and checks that it names a readable file.
   *
   * @param options parsed options; mutated
   * @return batch input file
   * @throws IllegalArgumentException when the argument is blank or the file is not readable
   */
  static Path takeInputFile(Map<String, String> options) {
    String in = options.remove(IN);
    if (in == null || in.isBlank()) {
      throw new IllegalArgumentException(IN + " must not be blank");
    }
    return Paths.requireReadableFile(IN, Path.of(in));
  }
}
