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

/**
 * Kerberos credential source.
 * <p>
 * The configuration literals are matched exactly. {@code USER_AUTH:} carries a trailing colon in deployed
 * configurations, so the colon is part of the literal.
 */
public enum GSSAPIAuthType {

  /**
   * Username and password.
   */
  USER_AUTH("USER_AUTH:"),

  /**
   * Keytab file.
   */
  KEYTAB_AUTH("KEYTAB_AUTH");

  private final String configValue;

  GSSAPIAuthType(final String configValue) {
    this.configValue = configValue;
  }

  public String configValue() {
    return configValue;
  }

  /**
   * @throws ProfileConfigException when {@code value} is not one of the exact literals.
   */
  public static GSSAPIAuthType parse(@Nullable final String value) {
    for (final var type : values()) {
      if (type.configValue.equals(value)) {
        return type;
      }
    }
    if ("USER_AUTH".equals(value)) {
      throw new ProfileConfigException(
        "unsupported GSSAPI auth type 'USER_AUTH', user authentication is selected with 'USER_AUTH:'"
      );
    }
    throw new ProfileConfigException(
      "unsupported GSSAPI auth type '" + value + "', expected 'USER_AUTH:' or 'KEYTAB_AUTH'"
    );
  }
}
