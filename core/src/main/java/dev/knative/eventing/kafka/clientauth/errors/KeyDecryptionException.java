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

package dev.knative.eventing.kafka.clientauth.errors;

/**
 * The private key is encrypted and the supplied passphrase does not decrypt it.
 */
public class KeyDecryptionException extends ConnectionProfileException {

  public KeyDecryptionException(final String message) {
    super(message);
  }

  public KeyDecryptionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
