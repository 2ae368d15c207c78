package ca.gc.cra.tide.domain.auth;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class AccessTokenTest {

  @Test
  void usableUntilSafetyMarginBeforeExpiry() {
    AccessToken token = AccessToken.issued("scoped", 0L, Duration.ofHours(1));

    assertTrue(token.isUsableAt(0L));
    assertTrue(token.isUsableAt(3_539_999L));
    assertFalse(token.isUsableAt(3_540_000L));
    assertFalse(token.isUsableAt(3_600_000L));
  }

  @Test
  void toStringHidesValue() {
    assertFalse(new AccessToken("secret-value", 1L).toString().contains("secret-value"));
  }

  @Test
  void rejectsBlankValue() {
    assertThrows(IllegalArgumentException.class, () -> new AccessToken(" ", 1L));
  }
}
