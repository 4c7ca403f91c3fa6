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

import javax.annotation.Nullable;

public class FileAccessException extends ConnectionProfileException {

  @Nullable
  private final String path;

  public FileAccessException(@Nullable final String path, final String message) {
    super(message);
    this.path = path;
  }

  public FileAccessException(@Nullable final String path, final String message, final Throwable cause) {
    super(message, cause);
    this.path = path;
  }

  /**
   * @return the path that could not be read, or null when the failure concerns more than one file.
   */
  @Nullable
  public String path() {
    return path;
  }
}
