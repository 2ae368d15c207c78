package ca.gc.cra.tide.infrastructure.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class JsonSupportTest {
  private final JsonSupport json = new JsonSupport();

  @Test
  void parsesNestedDocument() {
    Map<String, Object> doc = json.parseObject(
        "{\"channel_statuses\":{\"C\":{\"committed_offset_token\":\"7\"}},\"rows\":[1,2.5,null]}");

    Map<String, Object> statuses = JsonSupport.asObject(doc.get("channel_statuses"));
    Map<String, Object> channel = JsonSupport.asObject(statuses.get("C"));
    assertEquals(Optional.of(7L), JsonSupport.longValue(channel, "committed_offset_token"));
    List<?> rows = (List<?>) doc.get("rows");
    assertEquals(2.5d, ((Number) rows.get(1)).doubleValue());
    assertNull(rows.get(2));
  }

  @Test
  void rejectsTrailingContentAndMalformedInput() {
    assertThrows(IllegalArgumentException.class, () -> json.parse("{} {}"));
    assertThrows(IllegalArgumentException.class, () -> json.parse("{\"a\":"));
    assertThrows(IllegalArgumentException.class, () -> json.parseObject("\"text\""));
  }

  @Test
  void emptyDocumentIsEmptyObject() {
    assertTrue(json.parseObject("").isEmpty());
  }

  @Test
  void stringHelperTreatsBlankAsMissing() {
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("a", "  ");
    doc.put("b", " host ");

    assertEquals(Optional.empty(), JsonSupport.string(doc, "a"));
    assertEquals(Optional.of("host"), JsonSupport.string(doc, "b"));
    assertEquals(Optional.empty(), JsonSupport.string(null, "b"));
  }

  @Test
  void longHelperRejectsNonNumericText() {
    assertThrows(IllegalArgumentException.class,
        () -> JsonSupport.longValue(Map.of("offset", "abc"), "offset"));
  }

  @Test
  void writesScalarsAndCollections() {
    Map<String, Object> value = new LinkedHashMap<>();
    value.put("s", "x");
    value.put("n", 3);
    value.put("list", List.of(true, 1.5d));

    assertEquals("{\"s\":\"x\",\"n\":3,\"list\":[true,1.5]}", json.write(value));
  }
}
