/*
 * Copyright © 2018 Knative Authors (knative-dev@googlegroups.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.knative.eventing.kafka.clientauth.security;

import dev.knative.eventing.kafka.clientauth.errors.FileAccessException;
import dev.knative.eventing.kafka.clientauth.errors.KeyPairMismatchException;
import dev.knative.eventing.kafka.clientauth.errors.PemParseException;
import dev.knative.eventing.kafka.clientauth.file.FileReaders;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.Signature;
import java.security.cert.X509Certificate;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static dev.knative.eventing.kafka.clientauth.utils.Logging.keyValue;

public class CertificatePairLoader {

  private static final Logger logger = LoggerFactory.getLogger(CertificatePairLoader.class);

  static final String CERTIFICATE_ROLE = "certificate file";
  static final String KEY_ROLE = "key file";

  private static final String PAIR_REQUIRED = "certificate and key must be supplied as a pair";
  private static final byte[] CHALLENGE = "kafka-client-auth key pair check".getBytes(StandardCharsets.UTF_8);

  private CertificatePairLoader() {
  }

  /**
   * Load a client certificate and its private key, decrypting the key with {@code passphrase} if needed.
   *
   * @throws FileAccessException       when either file cannot be read.
   * @throws PemParseException         when the key file has no PEM block or the certificate file is malformed.
   * @throws dev.knative.eventing.kafka.clientauth.errors.KeyDecryptionException when the key cannot be decrypted.
   * @throws KeyPairMismatchException  when the key does not belong to the certificate.
   */
  public static CertificateKeyPair loadPair(final String certPath,
                                            final String keyPath,
                                            @Nullable final String passphrase) {
    checkReadable(certPath, keyPath);

    final var certificatePem = FileReaders.readAll(certPath, CERTIFICATE_ROLE);
    final var keyPem = FileReaders.readAll(keyPath, KEY_ROLE);

    final var decryptedKeyPem = PrivateKeyDecryptor.decrypt(keyPem, passphrase);

    final var chain = Certificates.parse(certificatePem, CERTIFICATE_ROLE + " '" + certPath + "'");
    if (chain.isEmpty()) {
      throw new PemParseException("no certificate found in " + CERTIFICATE_ROLE + " '" + certPath + "'");
    }

    final PrivateKey privateKey;
    try {
      privateKey = PrivateKeys.parse(decryptedKeyPem);
    } catch (final PemParseException ex) {
      throw new KeyPairMismatchException("invalid private key in " + KEY_ROLE + " '" + keyPath + "': "
        + ex.getMessage(), ex);
    }
    checkMatches(chain.get(0), privateKey, certPath, keyPath);

    final var pair = new CertificateKeyPair(certificatePem, decryptedKeyPem, chain, privateKey);
    logger.debug("loaded client certificate {} {}",
      keyValue("subject", chain.get(0).getSubjectX500Principal().getName()),
      keyValue("certPath", certPath));
    return pair;
  }

  private static void checkReadable(final String certPath, final String keyPath) {
    final var certReadable = FileReaders.canRead(certPath);
    final var keyReadable = FileReaders.canRead(keyPath);

    if (!certReadable && !keyReadable) {
      throw new FileAccessException(null, "cannot read key and certificate");
    }
    if (!certReadable) {
      throw new FileAccessException(certPath,
        "cannot read " + CERTIFICATE_ROLE + " '" + nullToEmpty(certPath) + "', " + PAIR_REQUIRED);
    }
    if (!keyReadable) {
      throw new FileAccessException(keyPath,
        "cannot read " + KEY_ROLE + " '" + nullToEmpty(keyPath) + "', " + PAIR_REQUIRED);
    }
  }

  private static void checkMatches(final X509Certificate certificate,
                                   final PrivateKey privateKey,
                                   final String certPath,
                                   final String keyPath) {
    final var mismatch = "private key in '" + keyPath + "' does not match certificate in '" + certPath + "'";
    final var publicKey = certificate.getPublicKey();
    if (!publicKey.getAlgorithm().equals(privateKey.getAlgorithm())) {
      throw new KeyPairMismatchException(mismatch + ": " + privateKey.getAlgorithm() + " key for a "
        + publicKey.getAlgorithm() + " certificate");
    }

    final var algorithm = signatureAlgorithm(privateKey.getAlgorithm());
    try {
      final var signer = Signature.getInstance(algorithm);
      signer.initSign(privateKey);
      signer.update(CHALLENGE);
      final var signature = signer.sign();

      final var verifier = Signature.getInstance(algorithm);
      verifier.initVerify(publicKey);
      verifier.update(CHALLENGE);
      if (!verifier.verify(signature)) {
        throw new KeyPairMismatchException(mismatch);
      }
    } catch (final GeneralSecurityException ex) {
      throw new KeyPairMismatchException(mismatch + ": " + ex.getMessage(), ex);
    }
  }

  private static String signatureAlgorithm(final String keyAlgorithm) {
    return switch (keyAlgorithm) {
      case "RSA" -> "SHA256withRSA";
      case "EC" -> "SHA256withECDSA";
      case "DSA" -> "SHA256withDSA";
      case "Ed25519", "Ed448", "EdDSA" -> "EdDSA";
      default -> throw new KeyPairMismatchException("unsupported private key algorithm " + keyAlgorithm);
    };
  }

  private static String nullToEmpty(@Nullable final String s) {
    return s == null ? "" : s;
  }
}
