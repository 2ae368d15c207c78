package ca.gc.cra.tide.config;

import ca.gc.cra.tide.infrastructure.json.JsonSupport;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link StreamingConfig} from the JSON connection file.
 *
 * @since 0.1.0
 */
public final class StreamingConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(StreamingConfigLoader.class);

  private StreamingConfigLoader() {}

  /**
   * Reads and validates the configuration file.
   *
   * @param path JSON file location
   * @return validated configuration
   * @throws IOException if the file exists but cannot be read
   * @throws ConfigurationException if the file is missing, is not a JSON object, or fails validation
   */
  public static StreamingConfig load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    String text;
    try {
      text = Files.readString(path, StandardCharsets.UTF_8);
    } catch (NoSuchFileException ex) {
      throw new ConfigurationException("Configuration file not found: " + path, ex);
    }
    Map<String, Object> document;
    try {
      document = new JsonSupport().parseObject(text);
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException("Configuration file is not a JSON object: " + path, ex);
    }
    StreamingConfig config = StreamingConfig.fromMap(document);
    log.info("Loaded config from {}", path);
    return config;
  }
}
