package ca.gc.cra.tide.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void parsesKeyValuePairsKeepingEqualsInValues() {
    Map<String, String> values = CliArgsParser.toMap(
        new String[] {"config=/etc/tide.json", " batchSize=5 ", "otelResourceAttributes=a=b,c=d"});

    assertEquals("/etc/tide.json", values.get("config"));
    assertEquals("5", values.get("batchSize"));
    assertEquals("a=b,c=d", values.get("otelResourceAttributes"));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"batchSize"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=5"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"batchSize="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"9lives=1"}));
  }

  @Test
  void nullArgsGiveEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }
}
