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

import dev.knative.eventing.kafka.clientauth.utils.Logging;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * TLS settings as supplied by the caller. Paths are not checked until the profile is built.
 */
public final class TLSConfig {

  private final boolean enabled;
  private final boolean insecureSkipVerify;
  private final String caFile;
  private final String certFile;
  private final String keyFile;
  private final String passphrase;

  private TLSConfig(final Builder builder) {
    this.enabled = builder.enabled;
    this.insecureSkipVerify = builder.insecureSkipVerify;
    this.caFile = builder.caFile;
    this.certFile = builder.certFile;
    this.keyFile = builder.keyFile;
    this.passphrase = builder.passphrase;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static TLSConfig disabled() {
    return builder().build();
  }

  public boolean enabled() {
    return enabled;
  }

  /**
   * When true the server certificate chain and host name are not verified.
   */
  public boolean insecureSkipVerify() {
    return insecureSkipVerify;
  }

  /**
   * @return path of a PEM bundle of CA certificates, or null to use the JVM default trust store.
   */
  @Nullable
  public String caFile() {
    return caFile;
  }

  @Nullable
  public String certFile() {
    return certFile;
  }

  @Nullable
  public String keyFile() {
    return keyFile;
  }

  @Nullable
  public String passphrase() {
    return passphrase;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TLSConfig)) {
      return false;
    }
    final var other = (TLSConfig) o;
    return enabled == other.enabled
      && insecureSkipVerify == other.insecureSkipVerify
      && Objects.equals(caFile, other.caFile)
      && Objects.equals(certFile, other.certFile)
      && Objects.equals(keyFile, other.keyFile)
      && Objects.equals(passphrase, other.passphrase);
  }

  @Override
  public int hashCode() {
    return Objects.hash(enabled, insecureSkipVerify, caFile, certFile, keyFile, passphrase);
  }

  @Override
  public String toString() {
    return "TLSConfig{" +
      "enabled=" + enabled +
      ", insecureSkipVerify=" + insecureSkipVerify +
      ", caFile='" + caFile + '\'' +
      ", certFile='" + certFile + '\'' +
      ", keyFile='" + keyFile + '\'' +
      ", passphrase='" + Logging.redact(passphrase) + '\'' +
      '}';
  }

  public static final class Builder {

    private boolean enabled;
    private boolean insecureSkipVerify;
    private String caFile;
    private String certFile;
    private String keyFile;
    private String passphrase;

    private Builder() {
    }

    public Builder withEnabled(final boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder withInsecureSkipVerify(final boolean insecureSkipVerify) {
      this.insecureSkipVerify = insecureSkipVerify;
      return this;
    }

    public Builder withCaFile(final String caFile) {
      this.caFile = caFile;
      return this;
    }

    public Builder withCertFile(final String certFile) {
      this.certFile = certFile;
      return this;
    }

    public Builder withKeyFile(final String keyFile) {
      this.keyFile = keyFile;
      return this;
    }

    public Builder withPassphrase(final String passphrase) {
      this.passphrase = passphrase;
      return this;
    }

    public TLSConfig build() {
      return new TLSConfig(this);
    }
  }
}
