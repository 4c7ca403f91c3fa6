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

import dev.knative.eventing.kafka.clientauth.sasl.GSSAPIAuthType;
import dev.knative.eventing.kafka.clientauth.sasl.SASLMechanism;
import dev.knative.eventing.kafka.clientauth.sasl.SASLProfile;
import dev.knative.eventing.kafka.clientauth.tls.TLSProfile;
import java.time.Duration;
import java.util.regex.Pattern;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

class ConnectionProfileValidator {

  private static final Pattern CLIENT_ID = Pattern.compile("^[A-Za-z0-9._-]+$");

  private ConnectionProfileValidator() {
  }

  /**
   * @return a description of the first problem found, or null when the profile is usable.
   */
  @Nullable
  static String validate(@Nonnull final ConnectionProfile profile) {
    if (!CLIENT_ID.matcher(profile.clientId()).matches()) {
      return "ClientID is invalid: '" + profile.clientId() + "'";
    }

    if (!profile.version().isAtLeast(KafkaVersion.MIN_SUPPORTED)) {
      return "Version " + profile.version() + " is not supported, minimum is " + KafkaVersion.MIN_SUPPORTED;
    }

    final var timeouts = profile.timeouts();
    if (notPositive(timeouts.keepAlive()) || notPositive(timeouts.dial())
      || notPositive(timeouts.read()) || notPositive(timeouts.write())) {
      return "Net timeouts must be > 0";
    }

    final var tlsError = validate(profile.tls());
    if (tlsError != null) {
      return tlsError;
    }

    return validate(profile.sasl(), profile.version());
  }

  @Nullable
  private static String validate(final TLSProfile tls) {
    if (tls.enabled()) {
      return null;
    }
    if (tls.clientCertificate() != null || !tls.trustedCertificates().isEmpty()) {
      return "TLS material present but TLS is disabled";
    }
    return null;
  }

  @Nullable
  private static String validate(final SASLProfile sasl, final KafkaVersion version) {
    if (!sasl.enabled()) {
      return null;
    }

    final var mechanism = sasl.mechanism();
    if (mechanism == SASLMechanism.NONE) {
      return "SASL enabled without a mechanism";
    }

    if (mechanism == SASLMechanism.PLAIN || mechanism.isScram()) {
      if (isBlank(sasl.username())) {
        return "SASL " + mechanism.mechanismName() + ": username must not be empty";
      }
      if (isBlank(sasl.password())) {
        return "SASL " + mechanism.mechanismName() + ": password must not be empty";
      }
    }

    if (mechanism.isScram()) {
      if (sasl.scramClientGenerator() == null) {
        return "SASL " + mechanism.mechanismName() + ": a SCRAM client generator is required";
      }
      if (!version.isAtLeast(KafkaVersion.MIN_SCRAM)) {
        return "SASL " + mechanism.mechanismName() + " requires version " + KafkaVersion.MIN_SCRAM + " or later, got " + version;
      }
    }

    if (mechanism == SASLMechanism.GSSAPI) {
      return validateGSSAPI(sasl);
    }

    return null;
  }

  @Nullable
  private static String validateGSSAPI(final SASLProfile sasl) {
    final var gssapi = sasl.gssapi();
    if (gssapi == null) {
      return "SASL GSSAPI: missing Kerberos configuration";
    }
    if (isBlank(gssapi.serviceName())) {
      return "SASL GSSAPI: service name must not be empty";
    }
    if (gssapi.authType() == GSSAPIAuthType.USER_AUTH && isBlank(gssapi.password())) {
      return "SASL GSSAPI: password must not be empty when using " + GSSAPIAuthType.USER_AUTH.configValue();
    }
    if (gssapi.authType() == GSSAPIAuthType.KEYTAB_AUTH && isBlank(gssapi.keytabPath())) {
      return "SASL GSSAPI: keytab path must not be empty when using " + GSSAPIAuthType.KEYTAB_AUTH.configValue();
    }
    if (isBlank(gssapi.kerberosConfigPath())) {
      return "SASL GSSAPI: Kerberos config path must not be empty";
    }
    if (isBlank(gssapi.username())) {
      return "SASL GSSAPI: username must not be empty";
    }
    if (isBlank(gssapi.realm())) {
      return "SASL GSSAPI: realm must not be empty";
    }
    return null;
  }

  private static boolean notPositive(final Duration duration) {
    return duration.isZero() || duration.isNegative();
  }

  private static boolean isBlank(final String s) {
    return s == null || s.isBlank();
  }
}
