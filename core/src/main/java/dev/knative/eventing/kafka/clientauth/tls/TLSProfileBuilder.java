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

package dev.knative.eventing.kafka.clientauth.tls;

import dev.knative.eventing.kafka.clientauth.errors.PemParseException;
import dev.knative.eventing.kafka.clientauth.file.FileReaders;
import dev.knative.eventing.kafka.clientauth.security.CertificateKeyPair;
import dev.knative.eventing.kafka.clientauth.security.CertificatePairLoader;
import dev.knative.eventing.kafka.clientauth.security.Certificates;
import java.nio.charset.StandardCharsets;
import java.security.cert.X509Certificate;
import java.util.List;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static dev.knative.eventing.kafka.clientauth.utils.Logging.keyValue;

public class TLSProfileBuilder {

  private static final Logger logger = LoggerFactory.getLogger(TLSProfileBuilder.class);

  static final String CA_FILE_ROLE = "CA file";

  private TLSProfileBuilder() {
  }

  /**
   * Resolve the TLS material referenced by {@code config}.
   * <p>
   * Note: this method is blocking, thus it shouldn't be called on the event loop.
   *
   * @throws dev.knative.eventing.kafka.clientauth.errors.ConnectionProfileException on the first unreadable,
   *                                                                                 malformed or mismatched file.
   */
  public static TLSProfile build(@Nonnull final TLSConfig config) {
    if (!config.enabled()) {
      logger.debug("TLS disabled");
      return TLSProfile.disabled();
    }

    if (config.insecureSkipVerify()) {
      logger.warn("TLS server certificate verification is disabled {}", keyValue("insecureSkipVerify", true));
    }

    List<X509Certificate> trusted = List.of();
    if (!isBlank(config.caFile())) {
      trusted = loadCertificateAuthorities(config.caFile());
    }

    CertificateKeyPair clientCertificate = null;
    if (!isBlank(config.certFile()) || !isBlank(config.keyFile())) {
      clientCertificate = CertificatePairLoader.loadPair(config.certFile(), config.keyFile(), config.passphrase());
    }

    return new TLSProfile(true, config.insecureSkipVerify(), trusted, clientCertificate);
  }

  private static List<X509Certificate> loadCertificateAuthorities(final String caFile) {
    final var pem = FileReaders.readAll(caFile, CA_FILE_ROLE);
    final var certificates = Certificates.parse(pem, CA_FILE_ROLE + " '" + caFile + "'");
    if (certificates.isEmpty()) {
      if (new String(pem, StandardCharsets.US_ASCII).isBlank()) {
        logger.warn("CA file is empty, the JVM default trust store is used {}", keyValue("caFile", caFile));
        return List.of();
      }
      throw new PemParseException("no certificate found in " + CA_FILE_ROLE + " '" + caFile + "'");
    }
    logger.debug("loaded CA certificates {} {}", keyValue("caFile", caFile), keyValue("count", certificates.size()));
    return certificates;
  }

  private static boolean isBlank(final String s) {
    return s == null || s.isBlank();
  }
}
