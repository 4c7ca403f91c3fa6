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
import java.nio.charset.StandardCharsets;
import java.security.cert.CertificateEncodingException;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;

public class Certificates {

  static final String CERTIFICATE_TYPE = "CERTIFICATE";

  private Certificates() {
  }

  /**
   * Parse every {@code CERTIFICATE} block of a PEM document. Blocks of any other type are skipped.
   *
   * @param pem    PEM document.
   * @param source where the document comes from, used in error messages.
   * @return the certificates in document order, possibly empty.
   * @throws PemParseException when a block is malformed or is not a valid X.509 certificate.
   */
  public static List<X509Certificate> parse(final byte[] pem, final String source) {
    final CertificateFactory factory;
    try {
      factory = CertificateFactory.getInstance("X.509");
    } catch (final CertificateException ex) {
      throw new IllegalStateException("X.509 certificate factory not available", ex);
    }

    final var certificates = new ArrayList<X509Certificate>();
    final List<PemBlock> blocks;
    try {
      blocks = PemDecoder.decodeAll(pem);
    } catch (final PemParseException ex) {
      throw new PemParseException("malformed PEM in " + source + ": " + ex.getMessage(), ex);
    }
    for (final var block : blocks) {
      if (!CERTIFICATE_TYPE.equals(block.type())) {
        continue;
      }
      try {
        certificates.add((X509Certificate) factory.generateCertificate(new ByteArrayInputStream(block.content())));
      } catch (final CertificateException ex) {
        throw new PemParseException("invalid certificate in " + source + ": " + ex.getMessage(), ex);
      }
    }
    return certificates;
  }

  /**
   * @return the certificates concatenated as PEM text.
   */
  public static String toPem(final List<X509Certificate> certificates) {
    final var pem = new StringBuilder();
    for (final var certificate : certificates) {
      try {
        final var block = new PemBlock(CERTIFICATE_TYPE, certificate.getEncoded());
        pem.append(new String(PemDecoder.encode(block), StandardCharsets.US_ASCII));
      } catch (final CertificateEncodingException ex) {
        throw new IllegalStateException("cannot encode certificate " + certificate.getSubjectX500Principal(), ex);
      }
    }
    return pem.toString();
  }
}
