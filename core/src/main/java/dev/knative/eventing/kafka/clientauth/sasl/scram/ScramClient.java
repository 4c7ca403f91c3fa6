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

import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import org.apache.kafka.common.security.scram.internals.ScramFormatter;
import org.apache.kafka.common.security.scram.internals.ScramMechanism;

/**
 * SCRAM credentials bound to one hash function.
 */
public final class ScramClient {

  private final ScramMechanism mechanism;
  private final ScramFormatter formatter;
  private final String username;
  private final String password;

  ScramClient(final ScramMechanism mechanism, final String username, final String password) {
    this.mechanism = mechanism;
    this.username = username;
    this.password = password;
    try {
      this.formatter = new ScramFormatter(mechanism);
    } catch (final NoSuchAlgorithmException ex) {
      throw new IllegalStateException("hash algorithm " + mechanism.hashAlgorithm() + " not available", ex);
    }
  }

  public String mechanismName() {
    return mechanism.mechanismName();
  }

  public String username() {
    return username;
  }

  /**
   * @return the digest of {@code input} with the mechanism's hash function.
   */
  public byte[] hash(final byte[] input) {
    return formatter.hash(input);
  }

  /**
   * Hi(password, salt, iterations) as defined by RFC 5802.
   *
   * @throws IllegalArgumentException when {@code iterations} is below the mechanism minimum.
   */
  public byte[] saltedPassword(final byte[] salt, final int iterations) {
    if (iterations < mechanism.minIterations()) {
      throw new IllegalArgumentException("iterations " + iterations + " below minimum " + mechanism.minIterations()
        + " for " + mechanism.mechanismName());
    }
    try {
      return formatter.saltedPassword(password, salt, iterations);
    } catch (final InvalidKeyException ex) {
      throw new IllegalStateException("cannot compute salted password for " + mechanism.mechanismName(), ex);
    }
  }

  @Override
  public String toString() {
    return "ScramClient{mechanism=" + mechanism.mechanismName() + ", username='" + username + "'}";
  }
}
