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

import dev.knative.eventing.kafka.clientauth.errors.KeyDecryptionException;
import dev.knative.eventing.kafka.clientauth.errors.PemParseException;
import java.io.IOException;
import javax.annotation.Nullable;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.jcajce.JceOpenSSLPKCS8DecryptorProviderBuilder;
import org.bouncycastle.openssl.jcajce.JcePEMDecryptorProviderBuilder;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;
import org.bouncycastle.pkcs.PKCSException;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static dev.knative.eventing.kafka.clientauth.utils.Logging.keyValue;

/**
 * Decrypts passphrase-protected PEM private keys.
 * <p>
 * Two formats are recognized:
 * <ul>
 *   <li>legacy OpenSSL encryption, signalled by the {@code Proc-Type: 4,ENCRYPTED} and {@code DEK-Info} headers.
 *   The decrypted key keeps the original block type ({@code RSA PRIVATE KEY}, {@code EC PRIVATE KEY}, ...).
 *   This format is insecure by modern standards and is only supported so that already deployed key files keep
 *   working; new deployments should keep keys in a secrets store instead of passphrase-protected files.</li>
 *   <li>PKCS#8 {@code ENCRYPTED PRIVATE KEY}, decrypted to a {@code PRIVATE KEY} block.</li>
 * </ul>
 * Any other key is returned unchanged.
 */
public class PrivateKeyDecryptor {

  private static final Logger logger = LoggerFactory.getLogger(PrivateKeyDecryptor.class);

  static final String ENCRYPTED_PKCS8_TYPE = "ENCRYPTED PRIVATE KEY";

  private static final String DECRYPTION_FAILED = "private key is encrypted, but could not decrypt it";

  // Not registered globally, only handed to the decryptor builders.
  private static final BouncyCastleProvider PROVIDER = new BouncyCastleProvider();

  private PrivateKeyDecryptor() {
  }

  /**
   * @param keyBytes   PEM encoded private key.
   * @param passphrase passphrase used when the key is encrypted, ignored otherwise.
   * @return the PEM encoded, unencrypted private key; {@code keyBytes} itself when the key is not encrypted.
   * @throws PemParseException      when {@code keyBytes} has no PEM block.
   * @throws KeyDecryptionException when the key is encrypted and cannot be decrypted with {@code passphrase}.
   */
  public static byte[] decrypt(final byte[] keyBytes, @Nullable final String passphrase) {
    final var block = PemDecoder.decode(keyBytes);
    if (block == null) {
      throw new PemParseException("no valid private key found");
    }

    if (block.isLegacyEncrypted()) {
      logger.warn("private key uses legacy PEM encryption, consider storing it unencrypted in a secrets store {}",
        keyValue("type", block.type()));
      return decryptLegacy(block, requirePassphrase(passphrase));
    }
    if (ENCRYPTED_PKCS8_TYPE.equals(block.type())) {
      return decryptPkcs8(block, requirePassphrase(passphrase));
    }

    logger.debug("private key is not encrypted {}", keyValue("type", block.type()));
    return keyBytes;
  }

  private static byte[] decryptLegacy(final PemBlock block, final char[] passphrase) {
    final var dekInfo = block.header(PemBlock.DEK_INFO_HEADER);
    final var separator = dekInfo.indexOf(',');
    if (separator < 0) {
      throw new KeyDecryptionException(DECRYPTION_FAILED + ": malformed DEK-Info header '" + dekInfo + "'");
    }
    final var algorithm = dekInfo.substring(0, separator).trim();

    try {
      final var iv = Hex.decode(dekInfo.substring(separator + 1).trim());
      final var decryptor = new JcePEMDecryptorProviderBuilder()
        .setProvider(PROVIDER)
        .build(passphrase)
        .get(algorithm);
      final var der = decryptor.decrypt(block.content(), iv);
      return verified(new PemBlock(block.type(), der));
    } catch (final OperatorCreationException | IOException | DecoderException ex) {
      throw new KeyDecryptionException(DECRYPTION_FAILED + ": " + ex.getMessage(), ex);
    }
  }

  private static byte[] decryptPkcs8(final PemBlock block, final char[] passphrase) {
    try {
      final var encrypted = new PKCS8EncryptedPrivateKeyInfo(block.content());
      final var decryptor = new JceOpenSSLPKCS8DecryptorProviderBuilder()
        .setProvider(PROVIDER)
        .build(passphrase);
      final var keyInfo = encrypted.decryptPrivateKeyInfo(decryptor);
      return verified(new PemBlock(PrivateKeys.PKCS8_TYPE, keyInfo.getEncoded()));
    } catch (final OperatorCreationException | PKCSException | IOException | IllegalArgumentException ex) {
      throw new KeyDecryptionException(DECRYPTION_FAILED + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * A wrong passphrase can still produce correctly padded output, so the decrypted key must parse.
   */
  private static byte[] verified(final PemBlock decrypted) {
    final var pem = PemDecoder.encode(decrypted);
    try {
      PrivateKeys.parse(pem);
    } catch (final PemParseException ex) {
      throw new KeyDecryptionException(DECRYPTION_FAILED + ": " + ex.getMessage(), ex);
    }
    return pem;
  }

  private static char[] requirePassphrase(@Nullable final String passphrase) {
    if (passphrase == null || passphrase.isEmpty()) {
      throw new KeyDecryptionException(DECRYPTION_FAILED + ": no passphrase supplied");
    }
    return passphrase.toCharArray();
  }
}
