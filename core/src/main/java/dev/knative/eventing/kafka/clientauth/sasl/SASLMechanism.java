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

import dev.knative.eventing.kafka.clientauth.errors.ProfileConfigException;
import javax.annotation.Nullable;

public enum SASLMechanism {

  /**
   * SASL disabled.
   */
  NONE(null),
  PLAIN("PLAIN"),
  SCRAM_SHA_256("SCRAM-SHA-256"),
  SCRAM_SHA_512("SCRAM-SHA-512"),
  GSSAPI("GSSAPI");

  private final String mechanismName;

  SASLMechanism(final String mechanismName) {
    this.mechanismName = mechanismName;
  }

  /**
   * Client key: sasl.mechanism
   *
   * @return the mechanism name as used on the wire, null for {@link #NONE}.
   */
  @Nullable
  public String mechanismName() {
    return mechanismName;
  }

  public boolean isScram() {
    return this == SCRAM_SHA_256 || this == SCRAM_SHA_512;
  }

  /**
   * Parse a configured mechanism name. Matching is exact; a missing value selects {@link #PLAIN}.
   *
   * @throws ProfileConfigException for any other value.
   */
  public static SASLMechanism parse(@Nullable final String value) {
    if (value == null || value.isBlank()) {
      return PLAIN;
    }
    for (final var mechanism : values()) {
      if (value.equals(mechanism.mechanismName)) {
        return mechanism;
      }
    }
    throw new ProfileConfigException(
      "unsupported SASL mechanism '" + value + "', expected PLAIN, SCRAM-SHA-256, SCRAM-SHA-512 or GSSAPI"
    );
  }
}
