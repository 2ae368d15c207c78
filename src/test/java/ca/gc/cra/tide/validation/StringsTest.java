package ca.gc.cra.tide.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("bob", Strings.requireNonBlank("user", "  bob  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("user", "bo\u0001b"));
  }

  @Test
  void requireIdentifierAcceptsWarehouseNames() {
    assertEquals("SENSEHAT_PIPE$1.v-2", Strings.requireIdentifier("pipe", "SENSEHAT_PIPE$1.v-2"));
  }

  @Test
  void requireIdentifierRejectsPathCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireIdentifier("pipe", "P/../X"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireIdentifier("pipe", "my pipe"));
  }

  @Test
  void trimToNullCollapsesBlankValues() {
    assertNull(Strings.trimToNull("   "));
    assertEquals("x", Strings.trimToNull(" x "));
  }

  @Test
  void requirePrintableAsciiRejectsNonAscii() {
    assertThrows(IllegalArgumentException.class,
        () -> Strings.requirePrintableAscii("attrs", "team=météo", 64));
  }

  @Test
  void requirePrintableAsciiRejectsExcessLength() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "abc", 2));
  }
}
