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

import dev.knative.eventing.kafka.clientauth.sasl.GSSAPIConfig;
import dev.knative.eventing.kafka.clientauth.sasl.SASLConfig;
import dev.knative.eventing.kafka.clientauth.tls.TLSConfig;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Function;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import static dev.knative.eventing.kafka.clientauth.utils.Configurations.asBoolean;

/**
 * Everything needed to build a {@link ConnectionProfile}.
 */
public final class ConnectionConfig {

  public static final String CLIENT_ID = "client.id";
  public static final String KAFKA_VERSION = "kafka.version";

  public static final String TLS_ENABLED = "tls.enabled";
  public static final String TLS_INSECURE_SKIP_VERIFY = "tls.insecure.skip.verify";
  public static final String TLS_CA_FILE = "tls.ca.file";
  public static final String TLS_CERT_FILE = "tls.cert.file";
  public static final String TLS_KEY_FILE = "tls.key.file";
  public static final String TLS_PASSPHRASE = "tls.passphrase";

  public static final String SASL_ENABLED = "sasl.enabled";
  public static final String SASL_USERNAME = "sasl.username";
  public static final String SASL_PASSWORD = "sasl.password";
  public static final String SASL_HANDSHAKE = "sasl.handshake";
  public static final String SASL_MECHANISM = "sasl.mechanism";

  public static final String SASL_GSSAPI_AUTH_TYPE = "sasl.gssapi.auth.type";
  public static final String SASL_GSSAPI_KEYTAB_PATH = "sasl.gssapi.keytab.path";
  public static final String SASL_GSSAPI_KERBEROS_CONFIG_PATH = "sasl.gssapi.kerberos.config.path";
  public static final String SASL_GSSAPI_SERVICE_NAME = "sasl.gssapi.service.name";
  public static final String SASL_GSSAPI_REALM = "sasl.gssapi.realm";
  public static final String SASL_GSSAPI_PASSWORD = "sasl.gssapi.password";

  private final String clientId;
  private final String clusterVersion;
  private final TLSConfig tls;
  private final SASLConfig sasl;

  private ConnectionConfig(final Builder builder) {
    this.clientId = builder.clientId;
    this.clusterVersion = builder.clusterVersion;
    this.tls = builder.tls;
    this.sasl = builder.sasl;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Read the configuration from a key lookup, for example {@code System::getenv} after mapping names, or a secret
   * mounted as a map.
   *
   * @param provider returns the value of a key, or null when the key is not set.
   * @throws dev.knative.eventing.kafka.clientauth.errors.ProfileConfigException on malformed boolean flags.
   */
  public static ConnectionConfig fromProvider(@Nonnull final Function<String, String> provider) {
    final var gssapi = GSSAPIConfig.builder()
      .withAuthType(provider.apply(SASL_GSSAPI_AUTH_TYPE))
      .withKeytabPath(provider.apply(SASL_GSSAPI_KEYTAB_PATH))
      .withKerberosConfigPath(provider.apply(SASL_GSSAPI_KERBEROS_CONFIG_PATH))
      .withServiceName(provider.apply(SASL_GSSAPI_SERVICE_NAME))
      .withRealm(provider.apply(SASL_GSSAPI_REALM))
      .withPassword(provider.apply(SASL_GSSAPI_PASSWORD))
      .build();

    final var sasl = SASLConfig.builder()
      .withEnabled(asBoolean(provider.apply(SASL_ENABLED), false))
      .withUsername(provider.apply(SASL_USERNAME))
      .withPassword(provider.apply(SASL_PASSWORD))
      .withHandshake(asBoolean(provider.apply(SASL_HANDSHAKE), true))
      .withMechanism(provider.apply(SASL_MECHANISM))
      .withGSSAPI(gssapi)
      .build();

    final var tls = TLSConfig.builder()
      .withEnabled(asBoolean(provider.apply(TLS_ENABLED), false))
      .withInsecureSkipVerify(asBoolean(provider.apply(TLS_INSECURE_SKIP_VERIFY), false))
      .withCaFile(provider.apply(TLS_CA_FILE))
      .withCertFile(provider.apply(TLS_CERT_FILE))
      .withKeyFile(provider.apply(TLS_KEY_FILE))
      .withPassphrase(provider.apply(TLS_PASSPHRASE))
      .build();

    return builder()
      .withClientId(provider.apply(CLIENT_ID))
      .withClusterVersion(provider.apply(KAFKA_VERSION))
      .withTLS(tls)
      .withSASL(sasl)
      .build();
  }

  public static ConnectionConfig fromProperties(@Nonnull final Properties properties) {
    return fromProvider(properties::getProperty);
  }

  /**
   * @return client id, blank means the default one.
   */
  @Nullable
  public String clientId() {
    return clientId;
  }

  @Nullable
  public String clusterVersion() {
    return clusterVersion;
  }

  public TLSConfig tls() {
    return tls;
  }

  public SASLConfig sasl() {
    return sasl;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ConnectionConfig)) {
      return false;
    }
    final var other = (ConnectionConfig) o;
    return Objects.equals(clientId, other.clientId)
      && Objects.equals(clusterVersion, other.clusterVersion)
      && tls.equals(other.tls)
      && sasl.equals(other.sasl);
  }

  @Override
  public int hashCode() {
    return Objects.hash(clientId, clusterVersion, tls, sasl);
  }

  @Override
  public String toString() {
    return "ConnectionConfig{" +
      "clientId='" + clientId + '\'' +
      ", clusterVersion='" + clusterVersion + '\'' +
      ", tls=" + tls +
      ", sasl=" + sasl +
      '}';
  }

  public static final class Builder {

    private String clientId;
    private String clusterVersion;
    private TLSConfig tls = TLSConfig.disabled();
    private SASLConfig sasl = SASLConfig.disabled();

    private Builder() {
    }

    public Builder withClientId(final String clientId) {
      this.clientId = clientId;
      return this;
    }

    public Builder withClusterVersion(final String clusterVersion) {
      this.clusterVersion = clusterVersion;
      return this;
    }

    public Builder withTLS(final TLSConfig tls) {
      this.tls = Objects.requireNonNull(tls);
      return this;
    }

    public Builder withSASL(final SASLConfig sasl) {
      this.sasl = Objects.requireNonNull(sasl);
      return this;
    }

    public ConnectionConfig build() {
      return new ConnectionConfig(this);
    }
  }
}
