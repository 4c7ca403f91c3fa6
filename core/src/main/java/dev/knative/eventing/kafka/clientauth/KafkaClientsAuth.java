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

package dev.knative.eventing.kafka.clientauth;

import dev.knative.eventing.kafka.clientauth.sasl.GSSAPIAuthType;
import dev.knative.eventing.kafka.clientauth.sasl.GSSAPIProfile;
import dev.knative.eventing.kafka.clientauth.sasl.SASLProfile;
import dev.knative.eventing.kafka.clientauth.security.Certificates;
import dev.knative.eventing.kafka.clientauth.tls.TLSProfile;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Properties;
import java.util.function.BiConsumer;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.common.config.SaslConfigs;
import org.apache.kafka.common.config.SslConfigs;
import org.apache.kafka.common.security.auth.SecurityProtocol;
import org.apache.kafka.common.security.plain.PlainLoginModule;
import org.apache.kafka.common.security.scram.ScramLoginModule;
import org.apache.kafka.common.security.ssl.DefaultSslEngineFactory;

/**
 * Render a {@link ConnectionProfile} as kafka-clients configurations.
 */
public class KafkaClientsAuth {

  static final String KRB5_LOGIN_MODULE = "com.sun.security.auth.module.Krb5LoginModule";

  private KafkaClientsAuth() {
  }

  public static void attachProfile(final Properties properties, final ConnectionProfile profile) {
    clientsProperties(properties::setProperty, profile);
  }

  public static void attachProfile(final Map<String, Object> configs, final ConnectionProfile profile) {
    clientsProperties(configs::put, profile);
  }

  private static void clientsProperties(final BiConsumer<String, String> propertiesSetter,
                                        final ConnectionProfile profile) {
    propertiesSetter.accept(CommonClientConfigs.CLIENT_ID_CONFIG, profile.clientId());
    propertiesSetter.accept(
      CommonClientConfigs.SOCKET_CONNECTION_SETUP_TIMEOUT_MS_CONFIG,
      String.valueOf(profile.timeouts().dial().toMillis())
    );
    propertiesSetter.accept(
      CommonClientConfigs.REQUEST_TIMEOUT_MS_CONFIG,
      String.valueOf(profile.timeouts().read().toMillis())
    );

    final var protocol = securityProtocol(profile);
    propertiesSetter.accept(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, protocol.name);
    switch (protocol) {
      case SSL -> ssl(propertiesSetter, profile.tls());
      case SASL_PLAINTEXT -> sasl(propertiesSetter, profile.sasl());
      case SASL_SSL -> {
        ssl(propertiesSetter, profile.tls());
        sasl(propertiesSetter, profile.sasl());
      }
      default -> {
      }
    }
  }

  static SecurityProtocol securityProtocol(final ConnectionProfile profile) {
    final var tls = profile.tls().enabled();
    final var sasl = profile.sasl().enabled();
    if (tls && sasl) {
      return SecurityProtocol.SASL_SSL;
    }
    if (tls) {
      return SecurityProtocol.SSL;
    }
    if (sasl) {
      return SecurityProtocol.SASL_PLAINTEXT;
    }
    return SecurityProtocol.PLAINTEXT;
  }

  private static void sasl(final BiConsumer<String, String> propertiesSetter, final SASLProfile sasl) {
    final var mechanism = sasl.mechanism();
    propertiesSetter.accept(SaslConfigs.SASL_MECHANISM, mechanism.mechanismName());
    switch (mechanism) {
      case PLAIN -> propertiesSetter.accept(SaslConfigs.SASL_JAAS_CONFIG, String.format(
        PlainLoginModule.class.getName() + " required username=%s password=%s;",
        quote(sasl.username()),
        quote(sasl.password())
      ));
      case SCRAM_SHA_256, SCRAM_SHA_512 -> propertiesSetter.accept(SaslConfigs.SASL_JAAS_CONFIG, String.format(
        ScramLoginModule.class.getName() + " required username=%s password=%s;",
        quote(sasl.username()),
        quote(sasl.password())
      ));
      case GSSAPI -> gssapi(propertiesSetter, sasl.gssapi());
      default -> throw new IllegalStateException("SASL mechanism required");
    }
  }

  private static void gssapi(final BiConsumer<String, String> propertiesSetter, final GSSAPIProfile gssapi) {
    if (gssapi == null) {
      throw new IllegalStateException("GSSAPI profile required");
    }
    propertiesSetter.accept(SaslConfigs.SASL_KERBEROS_SERVICE_NAME, gssapi.serviceName());

    final var principal = quote(gssapi.username() + "@" + gssapi.realm());
    if (gssapi.authType() == GSSAPIAuthType.KEYTAB_AUTH) {
      propertiesSetter.accept(SaslConfigs.SASL_JAAS_CONFIG, String.format(
        KRB5_LOGIN_MODULE + " required useKeyTab=true storeKey=true keyTab=%s principal=%s;",
        quote(gssapi.keytabPath()),
        principal
      ));
    } else {
      // The password is supplied through the login callback handler, it has no JAAS option.
      propertiesSetter.accept(SaslConfigs.SASL_JAAS_CONFIG, String.format(
        KRB5_LOGIN_MODULE + " required useTicketCache=false principal=%s;",
        principal
      ));
    }
  }

  private static void ssl(final BiConsumer<String, String> propertiesSetter, final TLSProfile tls) {
    if (!tls.trustedCertificates().isEmpty()) {
      propertiesSetter.accept(SslConfigs.SSL_TRUSTSTORE_TYPE_CONFIG, DefaultSslEngineFactory.PEM_TYPE);
      propertiesSetter.accept(
        SslConfigs.SSL_TRUSTSTORE_CERTIFICATES_CONFIG,
        Certificates.toPem(tls.trustedCertificates())
      );
    }
    final var keystore = tls.clientCertificate();
    if (keystore != null) {
      propertiesSetter.accept(SslConfigs.SSL_KEYSTORE_TYPE_CONFIG, DefaultSslEngineFactory.PEM_TYPE);
      propertiesSetter.accept(
        SslConfigs.SSL_KEYSTORE_CERTIFICATE_CHAIN_CONFIG,
        Certificates.toPem(keystore.certificateChain())
      );
      propertiesSetter.accept(
        SslConfigs.SSL_KEYSTORE_KEY_CONFIG,
        new String(keystore.pkcs8PrivateKeyPem(), StandardCharsets.US_ASCII)
      );
    }
    if (tls.insecureSkipVerify()) {
      propertiesSetter.accept(SslConfigs.SSL_ENDPOINT_IDENTIFICATION_ALGORITHM_CONFIG, "");
    }
  }

  private static String quote(final String value) {
    if (value == null) {
      return "\"\"";
    }
    return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
  }
}
