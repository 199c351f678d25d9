package ca.gc.cra.prplan.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits raw arguments into {@code key=value} pairs, bare positional tokens, and flags.
 * <p>Help and verbose aliases are recognized up front so every subcommand treats them the same way.</p>
 *
 * @since 0.1.0
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final List<String> keyValueArgs;
  private final List<String> positionals;
  private final Set<String> flags;
  private final boolean help;
  private final boolean verbose;

  private CliInput(
      List<String> keyValueArgs, List<String> positionals, Set<String> flags, boolean help, boolean verbose) {
    this.keyValueArgs = List.copyOf(keyValueArgs);
    this.positionals = List.copyOf(positionals);
    this.flags = Set.copyOf(flags);
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Parses raw arguments; {@code null} and blank entries are skipped.
   *
   * @param args raw arguments, may be {@code null}
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    List<String> positionals = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    boolean help = false;
    boolean verbose = false;
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        String lower = arg.toLowerCase(Locale.ROOT);
        if (HELP_FLAGS.contains(lower)) {
          help = true;
          flags.add("--help");
        } else if (VERBOSE_FLAGS.contains(lower)) {
          verbose = true;
          flags.add("--verbose");
        } else if (arg.startsWith("-") && !arg.contains("=")) {
          flags.add(lower);
        } else if (arg.contains("=")) {
          kv.add(arg);
        } else {
          positionals.add(arg);
        }
      }
    }
    return new CliInput(kv, positionals, flags, help, verbose);
  }

  /**
   * Returns the {@code key=value} arguments in order.
   *
   * @return copy of the key/value arguments
   */
  public String[] keyValueArgs() {
    return keyValueArgs.toArray(String[]::new);
  }

  /**
   * Returns bare tokens (subcommand, module) in order.
   *
   * @return immutable list of positional tokens
   */
  public List<String> positionals() {
    return positionals;
  }

  public boolean help() {
    return help;
  }

  public boolean verbose() {
    return verbose;
  }

  /**
   * Reports whether a {@code --flag} was supplied; matching ignores case.
   *
   * @param flag flag including its leading dashes
   * @return {@code true} when present
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }
}
