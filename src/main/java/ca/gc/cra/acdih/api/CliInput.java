package ca.gc.cra.acdih.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parsed representation of CLI arguments split into flags and positional/key-value tokens.
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final String[] tokens;
  private final Set<String> flags;

  private CliInput(String[] tokens, Set<String> flags) {
    this.tokens = tokens;
    this.flags = flags;
  }

  /**
   * Parses raw arguments. Help and verbose aliases are normalized to {@code --help} and
   * {@code --verbose}; any other dash-prefixed token without {@code '='} is kept as a lower-case flag.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation of the arguments
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], Set.of());
    }
    List<String> remaining = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        flags.add("--verbose");
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else {
        remaining.add(arg);
      }
    }
    return new CliInput(remaining.toArray(String[]::new), Set.copyOf(flags));
  }

  /**
   * Returns a copy of the non-flag arguments.
   *
   * @return copy of arguments in their original order
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(tokens, tokens.length);
  }

  /**
   * Indicates whether a help flag was supplied.
   *
   * @return {@code true} if help output was requested
   */
  public boolean help() {
    return flags.contains("--help");
  }

  /**
   * Indicates whether verbose logging was requested.
   *
   * @return {@code true} when --verbose (or equivalent) was present
   */
  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Returns flags other than help and verbose.
   *
   * @return unrecognized normalized flags
   */
  public Set<String> otherFlags() {
    Set<String> other = new LinkedHashSet<>(flags);
    other.remove("--help");
    other.remove("--verbose");
    return other;
  }
}
