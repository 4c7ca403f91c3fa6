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

import dev.knative.eventing.kafka.clientauth.sasl.SASLProfile;
import dev.knative.eventing.kafka.clientauth.tls.TLSProfile;
import java.util.Objects;

/**
 * Validated transport settings for a Kafka client connection.
 * <p>
 * Instances are built by {@link ConnectionProfiles#build(ConnectionConfig)} and are immutable.
 */
public final class ConnectionProfile {

  private final String clientId;
  private final KafkaVersion version;
  private final NetworkTimeouts timeouts;
  private final TLSProfile tls;
  private final SASLProfile sasl;

  ConnectionProfile(final String clientId,
                    final KafkaVersion version,
                    final NetworkTimeouts timeouts,
                    final TLSProfile tls,
                    final SASLProfile sasl) {
    this.clientId = Objects.requireNonNull(clientId);
    this.version = Objects.requireNonNull(version);
    this.timeouts = Objects.requireNonNull(timeouts);
    this.tls = Objects.requireNonNull(tls);
    this.sasl = Objects.requireNonNull(sasl);
  }

  public String clientId() {
    return clientId;
  }

  public KafkaVersion version() {
    return version;
  }

  public NetworkTimeouts timeouts() {
    return timeouts;
  }

  public TLSProfile tls() {
    return tls;
  }

  public SASLProfile sasl() {
    return sasl;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ConnectionProfile)) {
      return false;
    }
    final var other = (ConnectionProfile) o;
    return clientId.equals(other.clientId)
      && version.equals(other.version)
      && timeouts.equals(other.timeouts)
      && tls.equals(other.tls)
      && sasl.equals(other.sasl);
  }

  @Override
  public int hashCode() {
    return Objects.hash(clientId, version, timeouts, tls, sasl);
  }

  @Override
  public String toString() {
    return "ConnectionProfile{" +
      "clientId='" + clientId + '\'' +
      ", version=" + version +
      ", timeouts=" + timeouts +
      ", tls=" + tls +
      ", sasl=" + sasl +
      '}';
  }
}
