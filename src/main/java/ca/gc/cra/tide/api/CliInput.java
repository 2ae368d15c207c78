package ca.gc.cra.tide.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Command-line tokens split into switches such as {@code --dry-run} and {@code key=value} settings.
 *
 * <p>Aliases are folded into a canonical switch: {@code -h} and {@code help} become {@code --help},
 * {@code -v} and {@code --debug} become {@code --verbose}.</p>
 */
final class CliInput {
  private static final Map<String, String> ALIASES = Map.of(
      "-h", "--help",
      "help", "--help",
      "--help", "--help",
      "-v", "--verbose",
      "--debug", "--verbose",
      "--verbose", "--verbose");

  private final List<String> settings;
  private final Set<String> switches;

  private CliInput(List<String> settings, Set<String> switches) {
    this.settings = settings;
    this.switches = switches;
  }

  static CliInput parse(String[] args) {
    List<String> settings = new ArrayList<>();
    Set<String> switches = new LinkedHashSet<>();
    for (String raw : args == null ? new String[0] : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      String alias = ALIASES.get(lower);
      if (alias != null) {
        switches.add(alias);
      } else if (arg.startsWith("-") && arg.indexOf('=') < 0) {
        switches.add(lower);
      } else {
        settings.add(arg);
      }
    }
    return new CliInput(List.copyOf(settings), Set.copyOf(switches));
  }

  /**
   * Tokens that are not switches, in their original order.
   *
   * @return copy of the remaining tokens
   */
  String[] keyValueArgs() {
    return settings.toArray(String[]::new);
  }

  boolean help() {
    return switches.contains("--help");
  }

  boolean verbose() {
    return switches.contains("--verbose");
  }

  boolean hasFlag(String flag) {
    return flag != null && switches.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Switches other than help and verbose that the command does not recognise.
   *
   * @param known switches the command accepts
   * @return unrecognised switches
   */
  Set<String> unknownFlags(String... known) {
    Set<String> unknown = new LinkedHashSet<>(switches);
    unknown.remove("--help");
    unknown.remove("--verbose");
    unknown.removeAll(Arrays.asList(known));
    return unknown;
  }
}
