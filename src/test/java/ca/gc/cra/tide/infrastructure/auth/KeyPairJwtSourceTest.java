package ca.gc.cra.tide.infrastructure.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tide.infrastructure.json.JsonSupport;
import ca.gc.cra.tide.testing.MutableClock;
import ca.gc.cra.tide.testing.RecordingMetricsPort;
import ca.gc.cra.tide.testing.TestKeys;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.MessageDigest;
import java.security.Signature;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class KeyPairJwtSourceTest {
  private final KeyPair keyPair = TestKeys.rsa();
  private final MutableClock clock = MutableClock.atEpoch();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final JsonSupport json = new JsonSupport();

  @Test
  void tokenCarriesQualifiedClaims() throws Exception {
    KeyPairJwtSource source = new KeyPairJwtSource("xy12345", "bob", keyPair, clock, metrics);

    String[] parts = source.bearerToken().split("\\.");

    assertEquals(3, parts.length);
    Map<String, Object> header = json.parseObject(decode(parts[0]));
    assertEquals("RS256", header.get("alg"));
    assertEquals("JWT", header.get("typ"));
    Map<String, Object> claims = json.parseObject(decode(parts[1]));
    String fingerprint = KeyPairJwtSource.fingerprint(keyPair.getPublic());
    assertEquals("XY12345.BOB." + fingerprint, claims.get("iss"));
    assertEquals("XY12345.BOB", claims.get("sub"));
    long iat = clock.nowMillis() / 1000L;
    assertEquals(Optional.of(iat), JsonSupport.longValue(claims, "iat"));
    assertEquals(Optional.of(iat + 3600L), JsonSupport.longValue(claims, "exp"));
    assertEquals("KEYPAIR_JWT", source.tokenType());
  }

  @Test
  void signatureVerifiesWithPublicKey() throws Exception {
    String token = new KeyPairJwtSource("acct", "user", keyPair, clock, metrics).bearerToken();
    int lastDot = token.lastIndexOf('.');

    Signature verifier = Signature.getInstance("SHA256withRSA");
    verifier.initVerify(keyPair.getPublic());
    verifier.update(token.substring(0, lastDot).getBytes(StandardCharsets.US_ASCII));

    assertTrue(verifier.verify(Base64.getUrlDecoder().decode(token.substring(lastDot + 1))));
    assertTrue(!token.contains("="), "segments must be unpadded base64url");
  }

  @Test
  void fingerprintIsSha256OfEncodedPublicKey() throws Exception {
    byte[] digest = MessageDigest.getInstance("SHA-256").digest(keyPair.getPublic().getEncoded());

    assertEquals("SHA256:" + Base64.getEncoder().encodeToString(digest),
        KeyPairJwtSource.fingerprint(keyPair.getPublic()));
  }

  @Test
  void reusesTokenUntilSafetyMarginThenRegenerates() throws Exception {
    KeyPairJwtSource source = new KeyPairJwtSource("acct", "user", keyPair, clock, metrics);

    String first = source.bearerToken();
    clock.advance(Duration.ofSeconds(3539));
    String second = source.bearerToken();
    clock.advance(Duration.ofSeconds(2));
    String third = source.bearerToken();

    assertEquals(first, second);
    assertNotEquals(first, third);
    assertEquals(2, metrics.count("stream.jwt.generated"));
  }

  private static String decode(String segment) {
    return new String(Base64.getUrlDecoder().decode(segment), StandardCharsets.UTF_8);
  }
}
