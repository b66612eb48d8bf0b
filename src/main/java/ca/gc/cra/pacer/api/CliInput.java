package ca.gc.cra.pacer.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits raw arguments into {@code key=value} tokens and flags, folding help, verbose and dry-run aliases to
 * their canonical flag.
 *
 * @since PACER 0.1
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");
  private static final Set<String> DRY_RUN_FLAGS = Set.of("--dry-run", "-n", "--plan");

  private final String[] keyValueArgs;
  private final Set<String> flags;
  private final boolean help;
  private final boolean verbose;
  private final boolean dryRun;

  private CliInput(String[] keyValueArgs, Set<String> flags) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
    this.help = flags.contains("--help");
    this.verbose = flags.contains("--verbose");
    this.dryRun = flags.contains("--dry-run");
  }

  /**
   * Parses raw arguments. Tokens starting with {@code -} and lacking {@code =} are flags (lower-cased); anything
   * else is kept as a key/value token, including bare command names.
   *
   * @param args raw arguments; may be {@code null}
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], Set.of());
    }
    List<String> kv = new ArrayList<>();
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
      } else if (DRY_RUN_FLAGS.contains(lower)) {
        flags.add("--dry-run");
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else {
        kv.add(arg);
      }
    }
    return new CliInput(kv.toArray(String[]::new), Set.copyOf(flags));
  }

  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  public boolean help() {
    return help;
  }

  public boolean verbose() {
    return verbose;
  }

  /**
   * Indicates a validate-only run ({@code --dry-run}, {@code -n} or {@code --plan}).
   *
   * @return {@code true} when the command should print its plan and exit
   */
  public boolean dryRun() {
    return dryRun;
  }

  /**
   * Tests for a flag, case-insensitively.
   *
   * @param flag flag including its dashes
   * @return {@code true} when present
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }
}
