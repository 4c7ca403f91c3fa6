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

import dev.knative.eventing.kafka.clientauth.errors.ProfileConfigException;
import java.util.Arrays;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * Kafka cluster version.
 * <p>
 * Accepted formats are the legacy four part {@code 0.X.Y.Z} and {@code X.Y.Z} with {@code X >= 1}.
 */
public final class KafkaVersion implements Comparable<KafkaVersion> {

  private static final Pattern LEGACY_FORMAT = Pattern.compile("^0\\.\\d+\\.\\d+\\.\\d+$");
  private static final Pattern FORMAT = Pattern.compile("^\\d+\\.\\d+\\.\\d+$");

  public static final KafkaVersion V0_8_2_0 = new KafkaVersion(0, 8, 2, 0);
  public static final KafkaVersion V0_10_2_0 = new KafkaVersion(0, 10, 2, 0);
  public static final KafkaVersion V1_0_0 = new KafkaVersion(1, 0, 0);

  /**
   * Oldest version a profile can target.
   */
  public static final KafkaVersion MIN_SUPPORTED = V0_8_2_0;

  /**
   * First version supporting SCRAM authentication.
   */
  public static final KafkaVersion MIN_SCRAM = V0_10_2_0;

  private final int[] parts;

  private KafkaVersion(final int... parts) {
    this.parts = parts;
  }

  /**
   * Parse a version string.
   *
   * @throws ProfileConfigException when the string matches neither format.
   */
  public static KafkaVersion parse(@Nullable final String version) {
    if (version == null) {
      throw new ProfileConfigException("invalid version: null");
    }
    final var trimmed = version.trim();
    final var legacy = LEGACY_FORMAT.matcher(trimmed).matches();
    if (!legacy && !FORMAT.matcher(trimmed).matches()) {
      throw new ProfileConfigException("invalid version '" + version + "'");
    }

    final var tokens = trimmed.split("\\.");
    final var parts = new int[tokens.length];
    try {
      for (int i = 0; i < tokens.length; i++) {
        parts[i] = Integer.parseInt(tokens[i]);
      }
    } catch (final NumberFormatException ex) {
      throw new ProfileConfigException("invalid version '" + version + "'", ex);
    }
    if (!legacy && parts[0] == 0) {
      throw new ProfileConfigException("invalid version '" + version + "', 0.x versions use the 0.X.Y.Z format");
    }
    return new KafkaVersion(parts);
  }

  public boolean isAtLeast(final KafkaVersion other) {
    return compareTo(other) >= 0;
  }

  @Override
  public int compareTo(final KafkaVersion o) {
    final var a = normalized();
    final var b = o.normalized();
    for (int i = 0; i < 4; i++) {
      final var c = Integer.compare(a[i], b[i]);
      if (c != 0) {
        return c;
      }
    }
    return 0;
  }

  private int[] normalized() {
    if (parts.length == 4) {
      return parts;
    }
    // X.Y.Z is X.Y.Z.0
    return new int[]{parts[0], parts[1], parts[2], 0};
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof KafkaVersion)) {
      return false;
    }
    return Arrays.equals(normalized(), ((KafkaVersion) o).normalized());
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(normalized());
  }

  @Override
  public String toString() {
    final var sb = new StringBuilder();
    for (int i = 0; i < parts.length; i++) {
      if (i > 0) {
        sb.append('.');
      }
      sb.append(parts[i]);
    }
    return sb.toString();
  }
}
