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

public final class GSSAPIProfile {

  private final GSSAPIAuthType authType;
  private final String username;
  private final String password;
  private final String keytabPath;
  private final String kerberosConfigPath;
  private final String serviceName;
  private final String realm;

  GSSAPIProfile(final GSSAPIAuthType authType,
                @Nullable final String username,
                @Nullable final String password,
                @Nullable final String keytabPath,
                @Nullable final String kerberosConfigPath,
                @Nullable final String serviceName,
                @Nullable final String realm) {
    this.authType = Objects.requireNonNull(authType);
    this.username = username;
    this.password = password;
    this.keytabPath = keytabPath;
    this.kerberosConfigPath = kerberosConfigPath;
    this.serviceName = serviceName;
    this.realm = realm;
  }

  public GSSAPIAuthType authType() {
    return authType;
  }

  @Nullable
  public String username() {
    return username;
  }

  /**
   * @return Kerberos password, null unless {@link GSSAPIAuthType#USER_AUTH}.
   */
  @Nullable
  public String password() {
    return password;
  }

  /**
   * @return keytab path, null unless {@link GSSAPIAuthType#KEYTAB_AUTH}.
   */
  @Nullable
  public String keytabPath() {
    return keytabPath;
  }

  /**
   * The krb5.conf location. The JVM reads it from the {@code java.security.krb5.conf} system property, which is
   * left to the caller to set.
   */
  @Nullable
  public String kerberosConfigPath() {
    return kerberosConfigPath;
  }

  /**
   * Client key: sasl.kerberos.service.name
   */
  @Nullable
  public String serviceName() {
    return serviceName;
  }

  @Nullable
  public String realm() {
    return realm;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof GSSAPIProfile)) {
      return false;
    }
    final var other = (GSSAPIProfile) o;
    return authType == other.authType
      && Objects.equals(username, other.username)
      && Objects.equals(password, other.password)
      && Objects.equals(keytabPath, other.keytabPath)
      && Objects.equals(kerberosConfigPath, other.kerberosConfigPath)
      && Objects.equals(serviceName, other.serviceName)
      && Objects.equals(realm, other.realm);
  }

  @Override
  public int hashCode() {
    return Objects.hash(authType, username, password, keytabPath, kerberosConfigPath, serviceName, realm);
  }

  @Override
  public String toString() {
    return "GSSAPIProfile{" +
      "authType=" + authType +
      ", username='" + username + '\'' +
      ", password='" + Logging.redact(password) + '\'' +
      ", keytabPath='" + keytabPath + '\'' +
      ", kerberosConfigPath='" + kerberosConfigPath + '\'' +
      ", serviceName='" + serviceName + '\'' +
      ", realm='" + realm + '\'' +
      '}';
  }
}
