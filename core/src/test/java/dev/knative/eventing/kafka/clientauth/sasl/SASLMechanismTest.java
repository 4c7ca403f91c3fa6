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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.knative.eventing.kafka.clientauth.errors.ProfileConfigException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

public class SASLMechanismTest {

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"   "})
  public void missingMechanismIsPlain(final String value) {
    assertThat(SASLMechanism.parse(value)).isEqualTo(SASLMechanism.PLAIN);
  }

  @Test
  public void shouldParseExactNames() {
    assertThat(SASLMechanism.parse("PLAIN")).isEqualTo(SASLMechanism.PLAIN);
    assertThat(SASLMechanism.parse("SCRAM-SHA-256")).isEqualTo(SASLMechanism.SCRAM_SHA_256);
    assertThat(SASLMechanism.parse("SCRAM-SHA-512")).isEqualTo(SASLMechanism.SCRAM_SHA_512);
    assertThat(SASLMechanism.parse("GSSAPI")).isEqualTo(SASLMechanism.GSSAPI);
  }

  @ParameterizedTest
  @ValueSource(strings = {"plain", "SCRAM-SHA-1", "OAUTHBEARER", "NONE"})
  public void shouldRejectUnknownNames(final String value) {
    assertThatThrownBy(() -> SASLMechanism.parse(value))
      .isInstanceOf(ProfileConfigException.class)
      .hasMessageContaining(value);
  }

  @Test
  public void onlyScramMechanismsAreScram() {
    assertThat(SASLMechanism.SCRAM_SHA_256.isScram()).isTrue();
    assertThat(SASLMechanism.SCRAM_SHA_512.isScram()).isTrue();
    assertThat(SASLMechanism.PLAIN.isScram()).isFalse();
    assertThat(SASLMechanism.GSSAPI.isScram()).isFalse();
    assertThat(SASLMechanism.NONE.mechanismName()).isNull();
  }
}
