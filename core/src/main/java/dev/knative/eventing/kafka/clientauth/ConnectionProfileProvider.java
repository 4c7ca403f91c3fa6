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

import io.vertx.core.Future;
import io.vertx.core.Vertx;

@FunctionalInterface
public interface ConnectionProfileProvider {

  static ConnectionProfileProvider vertx(final Vertx vertx) {
    return new VertxConnectionProfileProvider(vertx);
  }

  /**
   * Get the connection profile for the given configuration.
   *
   * @param config connection configuration.
   * @return a future completed with the profile, or failed with the {@link
   * dev.knative.eventing.kafka.clientauth.errors.ConnectionProfileException} raised while building it.
   */
  Future<ConnectionProfile> getProfile(final ConnectionConfig config);
}
