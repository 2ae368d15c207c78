package ca.gc.cra.tide.testing;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/** Connection settings used across tests. */
public final class TestConfigs {
  private TestConfigs() {}

  /** Token-authenticated configuration for account {@code xy12345}, user {@code bob}, pipe {@code D.S.P}. */
  public static Map<String, Object> patConfig() {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("account", "xy12345");
    values.put("user", "bob");
    values.put("pat_token", "tok");
    values.put("database", "D");
    values.put("schema", "S");
    values.put("pipe", "P");
    return values;
  }

  public static Path writePatConfig(Path directory) throws IOException {
    String json = "{\"account\":\"xy12345\",\"user\":\"bob\",\"pat_token\":\"tok\","
        + "\"database\":\"D\",\"schema\":\"S\",\"pipe\":\"P\"}";
    return Files.writeString(directory.resolve("snowflake_config.json"), json, StandardCharsets.UTF_8);
  }
}
