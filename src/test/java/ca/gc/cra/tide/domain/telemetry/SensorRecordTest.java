package ca.gc.cra.tide.domain.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SensorRecordTest {

  @Test
  void keepsInsertionOrder() {
    SensorRecord record = SensorRecord.builder()
        .put("uuid", "u-1")
        .put("temperature", 21.5d)
        .put("simulated", true)
        .build();

    assertEquals(List.of("uuid", "temperature", "simulated"), List.copyOf(record.fields().keySet()));
    assertEquals(3, record.size());
    assertEquals(21.5d, record.get("temperature"));
  }

  @Test
  void rejectsEmptyRecords() {
    assertThrows(IllegalArgumentException.class, () -> SensorRecord.of(Map.of()));
  }

  @Test
  void rejectsNonScalarValues() {
    assertThrows(IllegalArgumentException.class,
        () -> SensorRecord.builder().put("nested", List.of(1, 2)).build());
    Map<String, Object> withNull = new LinkedHashMap<>();
    withNull.put("humidity", null);
    assertThrows(IllegalArgumentException.class, () -> SensorRecord.of(withNull));
  }

  @Test
  void rejectsNonFiniteNumbers() {
    assertThrows(IllegalArgumentException.class,
        () -> SensorRecord.builder().put("pressure", Double.NaN));
    assertThrows(IllegalArgumentException.class,
        () -> SensorRecord.builder().put("pressure", Float.POSITIVE_INFINITY));
  }

  @Test
  void fieldsAreReadOnly() {
    SensorRecord record = SensorRecord.of(Map.of("a", 1));

    assertThrows(UnsupportedOperationException.class, () -> record.fields().put("b", 2));
  }
}
