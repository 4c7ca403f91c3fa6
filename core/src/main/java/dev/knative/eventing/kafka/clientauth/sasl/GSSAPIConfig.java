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

package dev.knative.eventing.kafka.clientauth.sasl;

import dev.knative.eventing.kafka.clientauth.utils.Logging;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Kerberos settings, only read when the SASL mechanism is GSSAPI.
 */
public final class GSSAPIConfig {

  private static final GSSAPIConfig EMPTY = builder().build();

  private final String authType;
  private final String keytabPath;
  private final String kerberosConfigPath;
  private final String serviceName;
  private final String realm;
  private final String password;

  private GSSAPIConfig(final Builder builder) {
    this.authType = builder.authType;
    this.keytabPath = builder.keytabPath;
    this.kerberosConfigPath = builder.kerberosConfigPath;
    this.serviceName = builder.serviceName;
    this.realm = builder.realm;
    this.password = builder.password;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static GSSAPIConfig empty() {
    return EMPTY;
  }

  /**
   * @return "USER_AUTH:" or "KEYTAB_AUTH", see {@link GSSAPIAuthType}.
   */
  @Nullable
  public String authType() {
    return authType;
  }

  @Nullable
  public String keytabPath() {
    return keytabPath;
  }

  @Nullable
  public String kerberosConfigPath() {
    return kerberosConfigPath;
  }

  @Nullable
  public String serviceName() {
    return serviceName;
  }

  @Nullable
  public String realm() {
    return realm;
  }

  /**
   * @return Kerberos password, used when the SASL password is not set.
   */
  @Nullable
  public String password() {
    return password;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof GSSAPIConfig)) {
      return false;
    }
    final var other = (GSSAPIConfig) o;
    return Objects.equals(authType, other.authType)
      && Objects.equals(keytabPath, other.keytabPath)
      && Objects.equals(kerberosConfigPath, other.kerberosConfigPath)
      && Objects.equals(serviceName, other.serviceName)
      && Objects.equals(realm, other.realm)
      && Objects.equals(password, other.password);
  }

  @Override
  public int hashCode() {
    return Objects.hash(authType, keytabPath, kerberosConfigPath, serviceName, realm, password);
  }

  @Override
  public String toString() {
    return "GSSAPIConfig{" +
      "authType='" + authType + '\'' +
      ", keytabPath='" + keytabPath + '\'' +
      ", kerberosConfigPath='" + kerberosConfigPath + '\'' +
      ", serviceName='" + serviceName + '\'' +
      ", realm='" + realm + '\'' +
      ", password='" + Logging.redact(password) + '\'' +
      '}';
  }

  public static final class Builder {

    private String authType;
    private String keytabPath;
    private String kerberosConfigPath;
    private String serviceName;
    private String realm;
    private String password;

    private Builder() {
    }

    public Builder withAuthType(final String authType) {
      this.authType = authType;
      return this;
    }

    public Builder withKeytabPath(final String keytabPath) {
      this.keytabPath = keytabPath;
      return this;
    }

    public Builder withKerberosConfigPath(final String kerberosConfigPath) {
      this.kerberosConfigPath = kerberosConfigPath;
      return this;
    }

    public Builder withServiceName(final String serviceName) {
      this.serviceName = serviceName;
      return this;
    }

    public Builder withRealm(final String realm) {
      this.realm = realm;
      return this;
    }

    public Builder withPassword(final String password) {
      this.password = password;
      return this;
    }

    public GSSAPIConfig build() {
      return new GSSAPIConfig(this);
    }
  }
}
