package io.xk6.prometheus.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Command arguments split into global flags, unrecognised flags and {@code key=value} options.
 * <p>{@code --key=value} is accepted as a spelling of {@code key=value}.</p>
 *
 * @param options {@code key=value} arguments in command-line order
 * @param unknownFlags lower-cased flags that are neither help nor verbose
 * @param help whether usage was requested
 * @param verbose whether debug logging was requested
 */
record CliInput(List<String> options, List<String> unknownFlags, boolean help, boolean verbose) {

  /** Flags understood by every command. */
  enum GlobalFlag {
    HELP("--help", "-h", "help"),
    VERBOSE("--verbose", "-v", "--debug");

    private final List<String> spellings;

    GlobalFlag(String... spellings) {
      this.spellings = List.of(spellings);
    }

    static Optional<GlobalFlag> of(String arg) {
      String lower = arg.trim().toLowerCase(Locale.ROOT);
      for (GlobalFlag flag : values()) {
        if (flag.spellings.contains(lower)) {
          return Optional.of(flag);
        }
      }
      return Optional.empty();
    }
  }

  CliInput {
    options = List.copyOf(options);
    unknownFlags = List.copyOf(unknownFlags);
  }

  static CliInput parse(String[] args) {
    List<String> options = new ArrayList<>();
    List<String> unknown = new ArrayList<>();
    boolean help = false;
    boolean verbose = false;
    for (String raw : args == null ? new String[0] : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      Optional<GlobalFlag> flag = GlobalFlag.of(arg);
      if (flag.isPresent()) {
        help |= flag.get() == GlobalFlag.HELP;
        verbose |= flag.get() == GlobalFlag.VERBOSE;
      } else if (arg.startsWith("-") && arg.indexOf('=') < 0) {
        unknown.add(arg.toLowerCase(Locale.ROOT));
      } else {
        options.add(arg.startsWith("--") ? arg.substring(2) : arg);
      }
    }
    return new CliInput(options, unknown, help, verbose);
  }

  String[] keyValueArgs() {
    return options.toArray(String[]::new);
  }
}
