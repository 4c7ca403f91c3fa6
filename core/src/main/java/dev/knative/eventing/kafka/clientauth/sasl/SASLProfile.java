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

import dev.knative.eventing.kafka.clientauth.sasl.scram.ScramClientGenerator;
import dev.knative.eventing.kafka.clientauth.utils.Logging;
import java.util.Objects;
import javax.annotation.Nullable;

public final class SASLProfile {

  private static final SASLProfile DISABLED = new SASLProfile(false, null, null, false, SASLMechanism.NONE, null, null);

  private final boolean enabled;
  private final String username;
  private final String password;
  private final boolean handshake;
  private final SASLMechanism mechanism;
  private final ScramClientGenerator scramClientGenerator;
  private final GSSAPIProfile gssapi;

  SASLProfile(final boolean enabled,
              @Nullable final String username,
              @Nullable final String password,
              final boolean handshake,
              final SASLMechanism mechanism,
              @Nullable final ScramClientGenerator scramClientGenerator,
              @Nullable final GSSAPIProfile gssapi) {
    this.enabled = enabled;
    this.username = username;
    this.password = password;
    this.handshake = handshake;
    this.mechanism = Objects.requireNonNull(mechanism);
    this.scramClientGenerator = scramClientGenerator;
    this.gssapi = gssapi;
  }

  public static SASLProfile disabled() {
    return DISABLED;
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

  public boolean handshake() {
    return handshake;
  }

  public SASLMechanism mechanism() {
    return mechanism;
  }

  /**
   * @return the generator bound to the mechanism hash function, null unless the mechanism is SCRAM.
   */
  @Nullable
  public ScramClientGenerator scramClientGenerator() {
    return scramClientGenerator;
  }

  /**
   * @return Kerberos parameters, null unless the mechanism is GSSAPI.
   */
  @Nullable
  public GSSAPIProfile gssapi() {
    return gssapi;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SASLProfile)) {
      return false;
    }
    final var other = (SASLProfile) o;
    return enabled == other.enabled
      && handshake == other.handshake
      && mechanism == other.mechanism
      && Objects.equals(username, other.username)
      && Objects.equals(password, other.password)
      && Objects.equals(scramClientGenerator, other.scramClientGenerator)
      && Objects.equals(gssapi, other.gssapi);
  }

  @Override
  public int hashCode() {
    return Objects.hash(enabled, username, password, handshake, mechanism, scramClientGenerator, gssapi);
  }

  @Override
  public String toString() {
    return "SASLProfile{" +
      "enabled=" + enabled +
      ", username='" + username + '\'' +
      ", password='" + Logging.redact(password) + '\'' +
      ", handshake=" + handshake +
      ", mechanism=" + mechanism +
      ", scramClientGenerator=" + scramClientGenerator +
      ", gssapi=" + gssapi +
      '}';
  }
}
