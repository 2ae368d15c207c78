package ca.gc.cra.tide.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.tide.testing.TestConfigs;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StreamingConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void loadsJsonFile() throws Exception {
    Path file = TestConfigs.writePatConfig(tempDir);

    StreamingConfig config = StreamingConfigLoader.load(file);

    assertEquals("D.S.P", config.target().qualifiedName());
  }

  @Test
  void missingFileIsConfigurationError() {
    assertThrows(ConfigurationException.class,
        () -> StreamingConfigLoader.load(tempDir.resolve("snowflake_config.json")));
  }

  @Test
  void nonObjectDocumentIsConfigurationError() throws Exception {
    Path file = Files.writeString(tempDir.resolve("config.json"), "[1,2,3]");

    assertThrows(ConfigurationException.class, () -> StreamingConfigLoader.load(file));
  }

  @Test
  void malformedJsonIsConfigurationError() throws Exception {
    Path file = Files.writeString(tempDir.resolve("config.json"), "{\"account\":");

    assertThrows(ConfigurationException.class, () -> StreamingConfigLoader.load(file));
  }
}
