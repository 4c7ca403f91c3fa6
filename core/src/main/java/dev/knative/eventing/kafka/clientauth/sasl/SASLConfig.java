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

public final class SASLConfig {

  private final boolean enabled;
  private final String username;
  private final String password;
  private final boolean handshake;
  private final String mechanism;
  private final GSSAPIConfig gssapi;

  private SASLConfig(final Builder builder) {
    this.enabled = builder.enabled;
    this.username = builder.username;
    this.password = builder.password;
    this.handshake = builder.handshake;
    this.mechanism = builder.mechanism;
    this.gssapi = builder.gssapi;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static SASLConfig disabled() {
    return builder().build();
  }

  public boolean enabled() {
    return enabled;
  }

  @Nullable
  public String username() {
    return username;
  }

  @Nullable
  public String password() {
    return password;
  }

  /**
   * @return whether the SaslHandshake request is sent before authenticating.
   */
  public boolean handshake() {
    return handshake;
  }

  /**
   * @return configured mechanism name, null or blank for PLAIN.
   */
  @Nullable
  public String mechanism() {
    return mechanism;
  }

  public GSSAPIConfig gssapi() {
    return gssapi;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SASLConfig)) {
      return false;
    }
    final var other = (SASLConfig) o;
    return enabled == other.enabled
      && handshake == other.handshake
      && Objects.equals(username, other.username)
      && Objects.equals(password, other.password)
      && Objects.equals(mechanism, other.mechanism)
      && gssapi.equals(other.gssapi);
  }

  @Override
  public int hashCode() {
    return Objects.hash(enabled, username, password, handshake, mechanism, gssapi);
  }

  @Override
  public String toString() {
    return "SASLConfig{" +
      "enabled=" + enabled +
      ", username='" + username + '\'' +
      ", password='" + Logging.redact(password) + '\'' +
      ", handshake=" + handshake +
      ", mechanism='" + mechanism + '\'' +
      ", gssapi=" + gssapi +
      '}';
  }

  public static final class Builder {

    private boolean enabled;
    private String username;
    private String password;
    private boolean handshake = true;
    private String mechanism;
    private GSSAPIConfig gssapi = GSSAPIConfig.empty();

    private Builder() {
    }

    public Builder withEnabled(final boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder withUsername(final String username) {
      this.username = username;
      return this;
    }

    public Builder withPassword(final String password) {
      this.password = password;
      return this;
    }

    public Builder withHandshake(final boolean handshake) {
      this.handshake = handshake;
      return this;
    }

    public Builder withMechanism(final String mechanism) {
      this.mechanism = mechanism;
      return this;
    }

    public Builder withGSSAPI(final GSSAPIConfig gssapi) {
      this.gssapi = Objects.requireNonNull(gssapi);
      return this;
    }

    public SASLConfig build() {
      return new SASLConfig(this);
    }
  }
}
