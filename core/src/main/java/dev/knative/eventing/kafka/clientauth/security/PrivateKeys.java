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

import dev.knative.eventing.kafka.clientauth.errors.PemParseException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;

/**
 * Converts unencrypted PEM private keys (PKCS#1, SEC1 or PKCS#8) to JCA keys and back to PKCS#8 PEM.
 */
public class PrivateKeys {

  static final String PKCS8_TYPE = "PRIVATE KEY";

  private PrivateKeys() {
  }

  /**
   * @param pem unencrypted PEM private key.
   * @return the first private key found.
   * @throws PemParseException when no unencrypted private key can be parsed.
   */
  public static PrivateKey parse(final byte[] pem) {
    final var converter = new JcaPEMKeyConverter();
    final Object key;
    try {
      key = readKeyObject(pem);
      if (key instanceof PEMKeyPair) {
        return converter.getKeyPair((PEMKeyPair) key).getPrivate();
      }
      if (key instanceof PrivateKeyInfo) {
        return converter.getPrivateKey((PrivateKeyInfo) key);
      }
    } catch (final IOException | RuntimeException ex) {
      // BouncyCastle reports corrupt DER with unchecked exceptions as well.
      throw new PemParseException("invalid private key: " + ex.getMessage(), ex);
    }
    if (key instanceof PEMEncryptedKeyPair || key instanceof PKCS8EncryptedPrivateKeyInfo) {
      throw new PemParseException("private key is still encrypted");
    }
    throw new PemParseException("no valid private key found");
  }

  private static Object readKeyObject(final byte[] pem) throws IOException {
    try (final var parser = new PEMParser(
      new InputStreamReader(new ByteArrayInputStream(pem), StandardCharsets.US_ASCII))) {
      Object object;
      while ((object = parser.readObject()) != null) {
        if (object instanceof PEMKeyPair
          || object instanceof PrivateKeyInfo
          || object instanceof PEMEncryptedKeyPair
          || object instanceof PKCS8EncryptedPrivateKeyInfo) {
          return object;
        }
        // EC PARAMETERS and other blocks preceding the key are skipped.
      }
      return null;
    }
  }

  /**
   * @return the key as an unencrypted {@code PRIVATE KEY} (PKCS#8) PEM block.
   */
  public static byte[] toPkcs8Pem(final PrivateKey privateKey) {
    return PemDecoder.encode(new PemBlock(PKCS8_TYPE, privateKey.getEncoded()));
  }
}
