package ca.gc.cra.tide.infrastructure.auth;

import ca.gc.cra.tide.domain.error.CredentialException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.AlgorithmParameters;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.RSAPublicKeySpec;
import java.util.Base64;
import java.util.Objects;
import java.util.Set;
import javax.crypto.Cipher;
import javax.crypto.EncryptedPrivateKeyInfo;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads an RSA signing key from a PEM file and derives its public half.
 *
 * <p>Accepts PKCS#8 ({@code BEGIN PRIVATE KEY}) and passphrase-protected PKCS#8
 * ({@code BEGIN ENCRYPTED PRIVATE KEY}). Legacy PKCS#1 files must be converted with
 * {@code openssl pkcs8 -topk8} first.</p>
 *
 * @since 0.1.0
 */
final class PrivateKeyLoader {
  private static final Logger log = LoggerFactory.getLogger(PrivateKeyLoader.class);

  private static final String PKCS8_LABEL = "PRIVATE KEY";
  private static final String ENCRYPTED_PKCS8_LABEL = "ENCRYPTED PRIVATE KEY";
  private static final String PKCS1_LABEL = "RSA PRIVATE KEY";
  private static final Set<String> PBES2_NAMES = Set.of("PBES2", "1.2.840.113549.1.5.13");

  private PrivateKeyLoader() {}

  /**
   * Loads the key pair stored at {@code path}.
   *
   * @param path PEM file
   * @param passphrase passphrase for encrypted keys; may be {@code null}
   * @return private key with its derived public key
   * @throws CredentialException if the file is missing or unreadable, is not a supported PEM key, or the
   *     passphrase is wrong
   */
  static KeyPair load(Path path, String passphrase) throws CredentialException {
    Objects.requireNonNull(path, "path");
    String pem;
    try {
      pem = Files.readString(path, StandardCharsets.US_ASCII);
    } catch (IOException ex) {
      throw new CredentialException("Unable to read private key file " + path, ex);
    }
    PrivateKey privateKey = parse(pem, passphrase, path);
    return new KeyPair(derivePublicKey(privateKey), privateKey);
  }

  static PrivateKey parse(String pem, String passphrase, Object source) throws CredentialException {
    if (pem.contains("BEGIN " + PKCS1_LABEL)) {
      throw new CredentialException("PKCS#1 key in " + source
          + " is not supported; convert it with 'openssl pkcs8 -topk8'");
    }
    try {
      if (pem.contains("BEGIN " + ENCRYPTED_PKCS8_LABEL)) {
        if (passphrase == null || passphrase.isEmpty()) {
          throw new CredentialException("Private key " + source + " is encrypted but no passphrase is configured");
        }
        byte[] der = decodePem(pem, ENCRYPTED_PKCS8_LABEL, source);
        return rsaKey(decrypt(der, passphrase, source));
      }
      if (pem.contains("BEGIN " + PKCS8_LABEL)) {
        if (passphrase != null && !passphrase.isEmpty()) {
          log.warn("Passphrase configured but private key {} is not encrypted; ignoring passphrase", source);
        }
        return rsaKey(new PKCS8EncodedKeySpec(decodePem(pem, PKCS8_LABEL, source)));
      }
    } catch (GeneralSecurityException ex) {
      throw new CredentialException("Private key " + source + " is not a valid RSA key", ex);
    }
    throw new CredentialException("No PEM private key found in " + source);
  }

  private static PKCS8EncodedKeySpec decrypt(byte[] der, String passphrase, Object source)
      throws CredentialException {
    try {
      EncryptedPrivateKeyInfo info = new EncryptedPrivateKeyInfo(der);
      AlgorithmParameters params = info.getAlgParameters();
      String algorithm = PBES2_NAMES.contains(info.getAlgName()) && params != null
          ? params.toString()
          : info.getAlgName();
      SecretKeyFactory factory = SecretKeyFactory.getInstance(algorithm);
      SecretKey key = factory.generateSecret(new PBEKeySpec(passphrase.toCharArray()));
      Cipher cipher = Cipher.getInstance(algorithm);
      cipher.init(Cipher.DECRYPT_MODE, key, params);
      return info.getKeySpec(cipher);
    } catch (IOException | GeneralSecurityException ex) {
      throw new CredentialException(
          "Unable to decrypt private key " + source + " (wrong passphrase?)", ex);
    }
  }

  private static PrivateKey rsaKey(PKCS8EncodedKeySpec spec) throws GeneralSecurityException {
    return KeyFactory.getInstance("RSA").generatePrivate(spec);
  }

  private static byte[] decodePem(String pem, String label, Object source) throws CredentialException {
    String begin = "-----BEGIN " + label + "-----";
    String end = "-----END " + label + "-----";
    int start = pem.indexOf(begin);
    int stop = pem.indexOf(end, start + begin.length());
    if (start < 0 || stop < 0) {
      throw new CredentialException("Malformed PEM block in " + source);
    }
    String body = pem.substring(start + begin.length(), stop).replaceAll("\\s", "");
    try {
      return Base64.getDecoder().decode(body);
    } catch (IllegalArgumentException ex) {
      throw new CredentialException("PEM block in " + source + " is not valid base64", ex);
    }
  }

  static PublicKey derivePublicKey(PrivateKey privateKey) throws CredentialException {
    if (!(privateKey instanceof RSAPrivateCrtKey crt)) {
      throw new CredentialException("Private key does not carry RSA public parameters");
    }
    try {
      return KeyFactory.getInstance("RSA")
          .generatePublic(new RSAPublicKeySpec(crt.getModulus(), crt.getPublicExponent()));
    } catch (GeneralSecurityException ex) {
      throw new CredentialException("Unable to derive RSA public key", ex);
    }
  }
}
