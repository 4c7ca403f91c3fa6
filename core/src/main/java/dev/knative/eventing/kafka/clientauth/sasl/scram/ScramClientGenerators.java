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

package dev.knative.eventing.kafka.clientauth.sasl.scram;

import dev.knative.eventing.kafka.clientauth.sasl.SASLMechanism;
import javax.annotation.Nullable;
import org.apache.kafka.common.security.scram.internals.ScramMechanism;

public final class ScramClientGenerators {

  public static final ScramClientGenerator SHA_256 = new MechanismBound(ScramMechanism.SCRAM_SHA_256);
  public static final ScramClientGenerator SHA_512 = new MechanismBound(ScramMechanism.SCRAM_SHA_512);

  private ScramClientGenerators() {
  }

  /**
   * @return the generator of a SCRAM mechanism, null for any other mechanism.
   */
  @Nullable
  public static ScramClientGenerator forMechanism(final SASLMechanism mechanism) {
    return switch (mechanism) {
      case SCRAM_SHA_256 -> SHA_256;
      case SCRAM_SHA_512 -> SHA_512;
      default -> null;
    };
  }

  private static final class MechanismBound implements ScramClientGenerator {

    private final ScramMechanism mechanism;

    private MechanismBound(final ScramMechanism mechanism) {
      this.mechanism = mechanism;
    }

    @Override
    public String mechanismName() {
      return mechanism.mechanismName();
    }

    @Override
    public String hashAlgorithm() {
      return mechanism.hashAlgorithm();
    }

    @Override
    public ScramClient newClient(final String username, final String password) {
      return new ScramClient(mechanism, username, password);
    }

    @Override
    public String toString() {
      return "ScramClientGenerator{" + mechanism.mechanismName() + '}';
    }
  }
}
