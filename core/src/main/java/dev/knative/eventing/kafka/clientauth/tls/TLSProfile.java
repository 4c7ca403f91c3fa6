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

import dev.knative.eventing.kafka.clientauth.errors.ConnectionProfileException;
import dev.knative.eventing.kafka.clientauth.security.CertificateKeyPair;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nullable;
import javax.net.ssl.KeyManager;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;

public final class TLSProfile {

  private static final TLSProfile DISABLED = new TLSProfile(false, false, List.of(), null);

  // In-memory key store only.
  private static final char[] KEY_STORE_PASSWORD = "kafka-client-auth".toCharArray();
  private static final String CLIENT_KEY_ALIAS = "client";

  private final boolean enabled;
  private final boolean insecureSkipVerify;
  private final List<X509Certificate> trustedCertificates;
  private final CertificateKeyPair clientCertificate;

  TLSProfile(final boolean enabled,
             final boolean insecureSkipVerify,
             final List<X509Certificate> trustedCertificates,
             @Nullable final CertificateKeyPair clientCertificate) {
    this.enabled = enabled;
    this.insecureSkipVerify = insecureSkipVerify;
    this.trustedCertificates = List.copyOf(trustedCertificates);
    this.clientCertificate = clientCertificate;
  }

  public static TLSProfile disabled() {
    return DISABLED;
  }

  public boolean enabled() {
    return enabled;
  }

  public boolean insecureSkipVerify() {
    return insecureSkipVerify;
  }

  /**
   * @return CA certificates to trust; empty means the JVM default trust store.
   */
  public List<X509Certificate> trustedCertificates() {
    return trustedCertificates;
  }

  /**
   * @return the client certificate pair, or null for server-authenticated TLS only.
   */
  @Nullable
  public CertificateKeyPair clientCertificate() {
    return clientCertificate;
  }

  /**
   * Build an SSL context from this profile, for clients that take a {@link SSLContext} rather than Kafka client
   * properties.
   *
   * @throws ConnectionProfileException if TLS is disabled or the key material cannot be loaded in a key store.
   */
  public SSLContext createSSLContext() {
    if (!enabled) {
      throw new ConnectionProfileException("TLS is disabled");
    }
    try {
      final var context = SSLContext.getInstance("TLS");
      context.init(keyManagers(), trustManagers(), null);
      return context;
    } catch (final GeneralSecurityException | IOException ex) {
      throw new ConnectionProfileException("cannot create SSL context: " + ex.getMessage(), ex);
    }
  }

  @Nullable
  private KeyManager[] keyManagers() throws GeneralSecurityException, IOException {
    if (clientCertificate == null) {
      return null;
    }
    final var keyStore = KeyStore.getInstance("PKCS12");
    keyStore.load(null, null);
    keyStore.setKeyEntry(
      CLIENT_KEY_ALIAS,
      clientCertificate.privateKey(),
      KEY_STORE_PASSWORD,
      clientCertificate.certificateChain().toArray(new Certificate[0])
    );
    final var factory = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
    factory.init(keyStore, KEY_STORE_PASSWORD);
    return factory.getKeyManagers();
  }

  private TrustManager[] trustManagers() throws GeneralSecurityException, IOException {
    if (insecureSkipVerify) {
      return new TrustManager[]{new TrustAllManager()};
    }
    final var factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
    if (trustedCertificates.isEmpty()) {
      factory.init((KeyStore) null);
      return factory.getTrustManagers();
    }
    final var trustStore = KeyStore.getInstance("PKCS12");
    trustStore.load(null, null);
    for (int i = 0; i < trustedCertificates.size(); i++) {
      trustStore.setCertificateEntry("ca-" + i, trustedCertificates.get(i));
    }
    factory.init(trustStore);
    return factory.getTrustManagers();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TLSProfile)) {
      return false;
    }
    final var other = (TLSProfile) o;
    return enabled == other.enabled
      && insecureSkipVerify == other.insecureSkipVerify
      && trustedCertificates.equals(other.trustedCertificates)
      && Objects.equals(clientCertificate, other.clientCertificate);
  }

  @Override
  public int hashCode() {
    return Objects.hash(enabled, insecureSkipVerify, trustedCertificates, clientCertificate);
  }

  @Override
  public String toString() {
    return "TLSProfile{" +
      "enabled=" + enabled +
      ", insecureSkipVerify=" + insecureSkipVerify +
      ", trustedCertificates=" + trustedCertificates.size() +
      ", clientCertificate=" + clientCertificate +
      '}';
  }

  /**
   * Accepts any server certificate. Only installed when verification was explicitly disabled.
   */
  private static final class TrustAllManager implements X509TrustManager {

    @Override
    public void checkClientTrusted(final X509Certificate[] chain, final String authType) {
    }

    @Override
    public void checkServerTrusted(final X509Certificate[] chain, final String authType) {
    }

    @Override
    public X509Certificate[] getAcceptedIssuers() {
      return new X509Certificate[0];
    }
  }
}
