package ca.gc.cra.tide.api;

import ca.gc.cra.tide.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TIDE command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: tide <stream|verify> [options]";
  private static final String HELP_TEXT = """
      TIDE telemetry ingestion

      Usage:
        tide <command> [options]

      Commands:
        stream   Stream sensor readings into the configured pipe (stream --help for details)
        verify   Check credentials, host discovery and channel access without writing rows

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    String[] tokens = args == null ? new String[0] : args;
    int commandIndex = 0;
    while (commandIndex < tokens.length && tokens[commandIndex] != null
        && tokens[commandIndex].trim().startsWith("-")) {
      commandIndex++;
    }
    CliInput global = CliInput.parse(Arrays.copyOfRange(tokens, 0, commandIndex));
    if (global.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (global.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (commandIndex >= tokens.length || tokens[commandIndex] == null) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = tokens[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(tokens, commandIndex + 1, tokens.length);
    return switch (command) {
      case "stream" -> StreamCli.run(delegateArgs);
      case "verify" -> VerifyCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
