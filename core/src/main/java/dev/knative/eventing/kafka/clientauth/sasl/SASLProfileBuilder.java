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
import dev.knative.eventing.kafka.clientauth.sasl.scram.ScramClientGenerators;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static dev.knative.eventing.kafka.clientauth.utils.Logging.keyValue;

public class SASLProfileBuilder {

  private static final Logger logger = LoggerFactory.getLogger(SASLProfileBuilder.class);

  private SASLProfileBuilder() {
  }

  /**
   * Select the SASL mechanism and package its credentials.
   *
   * @throws dev.knative.eventing.kafka.clientauth.errors.ProfileConfigException on an unknown mechanism or GSSAPI
   *                                                                             auth type.
   */
  public static SASLProfile build(@Nonnull final SASLConfig config) {
    if (!config.enabled()) {
      logger.debug("SASL disabled");
      return SASLProfile.disabled();
    }

    final var mechanism = SASLMechanism.parse(config.mechanism());

    ScramClientGenerator scramClientGenerator = null;
    GSSAPIProfile gssapi = null;
    switch (mechanism) {
      case SCRAM_SHA_256, SCRAM_SHA_512 -> scramClientGenerator = ScramClientGenerators.forMechanism(mechanism);
      case GSSAPI -> gssapi = gssapi(config);
      default -> {
        // PLAIN carries no mechanism specific parameters.
      }
    }

    logger.debug("SASL enabled {} {}", keyValue("mechanism", mechanism.mechanismName()),
      keyValue("handshake", config.handshake()));

    return new SASLProfile(
      true,
      config.username(),
      config.password(),
      config.handshake(),
      mechanism,
      scramClientGenerator,
      gssapi
    );
  }

  private static GSSAPIProfile gssapi(final SASLConfig config) {
    final var gssapiConfig = config.gssapi();
    final var authType = GSSAPIAuthType.parse(gssapiConfig.authType());

    final var password = isBlank(config.password()) ? gssapiConfig.password() : config.password();

    return new GSSAPIProfile(
      authType,
      config.username(),
      authType == GSSAPIAuthType.USER_AUTH ? password : null,
      authType == GSSAPIAuthType.KEYTAB_AUTH ? gssapiConfig.keytabPath() : null,
      gssapiConfig.kerberosConfigPath(),
      gssapiConfig.serviceName(),
      gssapiConfig.realm()
    );
  }

  private static boolean isBlank(final String s) {
    return s == null || s.isBlank();
  }
}
