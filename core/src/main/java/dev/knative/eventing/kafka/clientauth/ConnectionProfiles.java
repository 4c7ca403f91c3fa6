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

import dev.knative.eventing.kafka.clientauth.errors.ConnectionProfileException;
import dev.knative.eventing.kafka.clientauth.errors.ProfileValidationException;
import dev.knative.eventing.kafka.clientauth.sasl.SASLProfileBuilder;
import dev.knative.eventing.kafka.clientauth.tls.TLSProfileBuilder;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static dev.knative.eventing.kafka.clientauth.utils.Logging.keyValue;

public class ConnectionProfiles {

  private static final Logger logger = LoggerFactory.getLogger(ConnectionProfiles.class);

  public static final String DEFAULT_CLIENT_ID = "kafka-client-auth";

  private ConnectionProfiles() {
  }

  /**
   * Build and validate a connection profile.
   * <p>
   * Note: this method reads certificate and key files, thus it shouldn't be called on the event loop, see
   * {@link VertxConnectionProfileProvider}.
   *
   * @param config connection configuration.
   * @return a validated profile.
   * @throws ConnectionProfileException at the first failing step.
   */
  public static ConnectionProfile build(@Nonnull final ConnectionConfig config) {
    try {
      final var profile = doBuild(config);
      logger.info("Connection profile built {} {} {} {} {}",
        keyValue("clientId", profile.clientId()),
        keyValue("version", profile.version()),
        keyValue("tls", profile.tls().enabled()),
        keyValue("sasl", profile.sasl().enabled()),
        keyValue("mechanism", profile.sasl().mechanism())
      );
      return profile;
    } catch (final ConnectionProfileException ex) {
      logger.warn("Failed to build connection profile {} {}",
        keyValue("clientId", config.clientId()),
        keyValue("error", ex.getMessage())
      );
      throw ex;
    }
  }

  private static ConnectionProfile doBuild(final ConnectionConfig config) {
    final var version = KafkaVersion.parse(config.clusterVersion());

    final var clientId = isBlank(config.clientId()) ? DEFAULT_CLIENT_ID : config.clientId();

    final var tls = TLSProfileBuilder.build(config.tls());
    final var sasl = SASLProfileBuilder.build(config.sasl());

    final var profile = new ConnectionProfile(clientId, version, NetworkTimeouts.DEFAULT, tls, sasl);

    final var error = ConnectionProfileValidator.validate(profile);
    if (error != null) {
      throw new ProfileValidationException(error);
    }
    return profile;
  }

  private static boolean isBlank(final String s) {
    return s == null || s.isBlank();
  }
}
