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

/**
 * Selects the hash function of a SCRAM mechanism and creates the clients bound to it.
 * <p>
 * Implementations are stateless. The challenge/response exchange is left to the Kafka client library.
 *
 * @see <a href="https://kafka.apache.org/documentation/#security_sasl_scram">SASL Scram</a>
 */
public interface ScramClientGenerator {

  /**
   * @return SCRAM-SHA-256 or SCRAM-SHA-512.
   */
  String mechanismName();

  /**
   * @return JCA name of the hash function, SHA-256 or SHA-512.
   */
  String hashAlgorithm();

  ScramClient newClient(String username, String password);
}
