package ca.gc.cra.tide.api;

import ca.gc.cra.tide.application.port.ClockPort;
import ca.gc.cra.tide.application.port.HttpTransport;
import ca.gc.cra.tide.application.port.MetricsPort;
import ca.gc.cra.tide.application.stream.ChannelSession;
import ca.gc.cra.tide.config.ConfigurationException;
import ca.gc.cra.tide.config.LoopConfig;
import ca.gc.cra.tide.config.StreamingConfig;
import ca.gc.cra.tide.config.StreamingConfigLoader;
import ca.gc.cra.tide.domain.error.IngestException;
import ca.gc.cra.tide.domain.stream.ChannelStatus;
import ca.gc.cra.tide.infrastructure.http.JdkHttpTransport;
import ca.gc.cra.tide.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a connection configuration end to end: authenticates, discovers the ingest host, exchanges a
 * scoped token, opens a channel and reads its status. No rows are written.
 *
 * @since 0.1.0
 */
public final class VerifyCli {
  private static final Logger log = LoggerFactory.getLogger(VerifyCli.class);
  private static final String SUMMARY_USAGE = "usage: verify [config=PATH]";
  private static final String HELP_TEXT = """
      TIDE connection check

      Usage:
        verify [config=PATH]

      Options:
        config=PATH  JSON connection file (default snowflake_config.json)
        --verbose    Enable DEBUG logging
        --help       Show this message
      """;

  private VerifyCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return run(args, new JdkHttpTransport(), ClockPort.SYSTEM);
  }

  static ExitCode run(String[] args, HttpTransport transport, ClockPort clock) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Path configPath;
    try {
      if (!input.unknownFlags().isEmpty()) {
        throw new IllegalArgumentException("unknown option(s): " + input.unknownFlags());
      }
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      String raw = kv.remove("config");
      if (!kv.isEmpty()) {
        throw new IllegalArgumentException("unknown argument(s): " + kv.keySet());
      }
      configPath = raw == null ? LoopConfig.DEFAULT_CONFIG_PATH : Path.of(raw);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    StreamingConfig config;
    try {
      config = StreamingConfigLoader.load(configPath);
    } catch (ConfigurationException ex) {
      log.error("Configuration error: {}", ex.getMessage());
      CliPrinter.println("[FAIL] configuration: " + ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration {}", configPath, ex);
      return ExitCode.IO_ERROR;
    }
    CliPrinter.println("[OK] configuration " + configPath + " (" + config.authMode() + ")");

    try {
      StreamingComponents components = StreamingComponents.wire(config, transport, clock, MetricsPort.NO_OP);
      components.credentials().bearerToken();
      CliPrinter.println("[OK] identity token (" + components.credentials().tokenType() + ")");
      CliPrinter.println("[OK] ingest host " + components.credentials().ingestHost());
      components.credentials().scopedToken();
      CliPrinter.println("[OK] scoped token");

      try (ChannelSession session = components.newSession()) {
        session.open();
        CliPrinter.println("[OK] channel " + session.channelName() + " opened at offset " + session.offset());
        ChannelStatus status = session.status();
        CliPrinter.println("[OK] channel status: committed offset " + status.committedOffset());
      }
      return ExitCode.SUCCESS;
    } catch (IngestException ex) {
      log.error("Connection check failed: {}", ex.getMessage(), ex);
      CliPrinter.println("[FAIL] " + ex.getMessage());
      return ExitCode.STARTUP_FAILURE;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return ExitCode.INTERRUPTED;
    }
  }
}
