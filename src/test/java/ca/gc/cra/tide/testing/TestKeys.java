package ca.gc.cra.tide.testing;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.util.Base64;

/** RSA key material generated per test run. */
public final class TestKeys {
  private static KeyPair shared;

  private TestKeys() {}

  /** Returns a 2048-bit pair shared by the test JVM; generation is slow. */
  public static synchronized KeyPair rsa() {
    if (shared == null) {
      try {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        shared = generator.generateKeyPair();
      } catch (GeneralSecurityException ex) {
        throw new IllegalStateException(ex);
      }
    }
    return shared;
  }

  /** Writes the private key as an unencrypted PKCS#8 PEM file. */
  public static Path writePkcs8(Path directory, KeyPair keyPair) throws IOException {
    return writePem(directory.resolve("rsa_key.p8"), "PRIVATE KEY", keyPair.getPrivate().getEncoded());
  }

  public static Path writePem(Path file, String label, byte[] der) throws IOException {
    String body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII)).encodeToString(der);
    String pem = "-----BEGIN " + label + "-----\n" + body + "\n-----END " + label + "-----\n";
    return Files.writeString(file, pem, StandardCharsets.US_ASCII);
  }
}
