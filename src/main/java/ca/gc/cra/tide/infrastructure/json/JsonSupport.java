package ca.gc.cra.tide.infrastructure.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Minimal JSON helper over the Jackson streaming API.
 *
 * <p>Parses documents into {@link Map}/{@link List} graphs and writes the same shapes back, which is all
 * the REST protocol and the configuration file need.</p>
 *
 * @since 0.1.0
 */
public final class JsonSupport {
  private final JsonFactory factory;

  public JsonSupport() {
    this(new JsonFactory());
  }

  JsonSupport(JsonFactory factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  /**
   * Parses the supplied JSON string into a mutable object graph of maps, lists, and primitives.
   *
   * @param json JSON document; never {@code null}
   * @return parsed object graph; an empty map for blank input
   * @throws IllegalArgumentException when parsing fails
   */
  public Object parse(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        return Map.of();
      }
      Object value = readValue(parser, token);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return value;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  /**
   * Parses a document that must be a JSON object.
   *
   * @param json JSON document
   * @return top-level object
   * @throws IllegalArgumentException when the document is malformed or not an object
   */
  public Map<String, Object> parseObject(String json) {
    Object value = parse(json);
    Map<String, Object> object = asObject(value);
    if (object == null) {
      throw new IllegalArgumentException("JSON document must be an object");
    }
    return object;
  }

  /**
   * Serializes a graph of maps, lists, and scalars as compact JSON.
   *
   * @param value graph to write
   * @return JSON text
   * @throws IllegalArgumentException when the graph contains unsupported types
   */
  public String write(Object value) {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = factory.createGenerator(out)) {
      writeValue(gen, value);
    } catch (IOException ex) {
      throw new IllegalArgumentException("Unable to serialize JSON", ex);
    }
    return out.toString();
  }

  /**
   * Returns the value as a JSON object if it is one.
   *
   * @param value parsed value
   * @return object or {@code null}
   */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> asObject(Object value) {
    return value instanceof Map<?, ?> ? (Map<String, Object>) value : null;
  }

  /**
   * Reads a string member, accepting numbers and booleans in their textual form.
   *
   * @param object JSON object; may be {@code null}
   * @param key member name
   * @return non-blank text if present
   */
  public static Optional<String> string(Map<String, Object> object, String key) {
    if (object == null) {
      return Optional.empty();
    }
    Object value = object.get(key);
    if (value == null) {
      return Optional.empty();
    }
    String text = value.toString().trim();
    return text.isEmpty() ? Optional.empty() : Optional.of(text);
  }

  /**
   * Reads an integral member that the service may send either as a number or as a numeric string.
   *
   * @param object JSON object; may be {@code null}
   * @param key member name
   * @return value if present
   * @throws IllegalArgumentException when the member is present but not integral
   */
  public static Optional<Long> longValue(Map<String, Object> object, String key) {
    if (object == null) {
      return Optional.empty();
    }
    Object value = object.get(key);
    if (value == null) {
      return Optional.empty();
    }
    if (value instanceof Number number) {
      return Optional.of(number.longValue());
    }
    String text = value.toString().trim();
    if (text.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Long.parseLong(text));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " is not an integer: " + text, ex);
    }
  }

  void writeValue(JsonGenerator gen, Object value) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof String text) {
      gen.writeString(text);
    } else if (value instanceof Boolean bool) {
      gen.writeBoolean(bool);
    } else if (value instanceof Integer || value instanceof Long
        || value instanceof Short || value instanceof Byte) {
      gen.writeNumber(((Number) value).longValue());
    } else if (value instanceof Double || value instanceof Float) {
      gen.writeNumber(((Number) value).doubleValue());
    } else if (value instanceof BigDecimal decimal) {
      gen.writeNumber(decimal);
    } else if (value instanceof BigInteger integer) {
      gen.writeNumber(integer);
    } else if (value instanceof Map<?, ?> map) {
      gen.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        gen.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(gen, entry.getValue());
      }
      gen.writeEndObject();
    } else if (value instanceof Iterable<?> items) {
      gen.writeStartArray();
      for (Object item : items) {
        writeValue(gen, item);
      }
      gen.writeEndArray();
    } else {
      throw new IllegalArgumentException("Unsupported JSON value type: " + value.getClass().getName());
    }
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      JsonToken valueToken = parser.nextToken();
      map.put(fieldName, readValue(parser, valueToken));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }
}
