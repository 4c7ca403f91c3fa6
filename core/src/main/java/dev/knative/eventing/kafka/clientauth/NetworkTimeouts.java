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

import java.time.Duration;
import java.util.Objects;

public final class NetworkTimeouts {

  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(15);

  public static final NetworkTimeouts DEFAULT = new NetworkTimeouts(
    DEFAULT_TIMEOUT,
    DEFAULT_TIMEOUT,
    DEFAULT_TIMEOUT,
    DEFAULT_TIMEOUT
  );

  private final Duration keepAlive;
  private final Duration dial;
  private final Duration read;
  private final Duration write;

  NetworkTimeouts(final Duration keepAlive, final Duration dial, final Duration read, final Duration write) {
    this.keepAlive = Objects.requireNonNull(keepAlive);
    this.dial = Objects.requireNonNull(dial);
    this.read = Objects.requireNonNull(read);
    this.write = Objects.requireNonNull(write);
  }

  public Duration keepAlive() {
    return keepAlive;
  }

  public Duration dial() {
    return dial;
  }

  public Duration read() {
    return read;
  }

  public Duration write() {
    return write;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof NetworkTimeouts)) {
      return false;
    }
    final var other = (NetworkTimeouts) o;
    return keepAlive.equals(other.keepAlive)
      && dial.equals(other.dial)
      && read.equals(other.read)
      && write.equals(other.write);
  }

  @Override
  public int hashCode() {
    return Objects.hash(keepAlive, dial, read, write);
  }

  @Override
  public String toString() {
    return "NetworkTimeouts{" +
      "keepAlive=" + keepAlive +
      ", dial=" + dial +
      ", read=" + read +
      ", write=" + write +
      '}';
  }
}
