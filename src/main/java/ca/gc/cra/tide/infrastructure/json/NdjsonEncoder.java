package ca.gc.cra.tide.infrastructure.json;

import ca.gc.cra.tide.domain.telemetry.SensorRecord;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Encodes a batch of records as newline-delimited JSON.
 *
 * <p>Output is one compact object per record, joined by {@code \n} with no trailing newline, in UTF-8.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonEncoder {
  private static final byte NEWLINE = '\n';

  private final JsonFactory jsonFactory = new JsonFactory();
  private final JsonSupport json = new JsonSupport(jsonFactory);

  /**
   * Serializes the batch.
   *
   * @param records records to encode; must not be {@code null}
   * @return UTF-8 payload; empty for an empty batch
   */
  public byte[] encode(List<SensorRecord> records) {
    Objects.requireNonNull(records, "records");
    ByteArrayOutputStream out = new ByteArrayOutputStream(records.size() * 256);
    boolean first = true;
    for (SensorRecord record : records) {
      if (!first) {
        out.write(NEWLINE);
      }
      first = false;
      writeRecord(out, record);
    }
    return out.toByteArray();
  }

  private void writeRecord(ByteArrayOutputStream out, SensorRecord record) {
    Objects.requireNonNull(record, "record");
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
      gen.writeStartObject();
      for (Map.Entry<String, Object> field : record.fields().entrySet()) {
        gen.writeFieldName(field.getKey());
        json.writeValue(gen, field.getValue());
      }
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new IllegalStateException("In-memory NDJSON encoding failed", ex);
    }
  }
}
