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

package dev.knative.eventing.kafka.clientauth.security;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * A single decoded PEM block: type, RFC 1421 headers and DER content.
 */
public final class PemBlock {

  static final String PROC_TYPE_HEADER = "Proc-Type";
  static final String DEK_INFO_HEADER = "DEK-Info";

  private final String type;
  private final Map<String, String> headers;
  private final byte[] content;

  public PemBlock(final String type, final Map<String, String> headers, final byte[] content) {
    this.type = type;
    this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    this.content = content.clone();
  }

  public PemBlock(final String type, final byte[] content) {
    this(type, Map.of(), content);
  }

  public String type() {
    return type;
  }

  public Map<String, String> headers() {
    return headers;
  }

  @Nullable
  public String header(final String name) {
    return headers.get(name);
  }

  public byte[] content() {
    return content.clone();
  }

  /**
   * The legacy OpenSSL encryption marker is a {@code Proc-Type: 4,ENCRYPTED} header together with a
   * {@code DEK-Info} header carrying the cipher name and IV.
   */
  public boolean isLegacyEncrypted() {
    final var procType = header(PROC_TYPE_HEADER);
    return procType != null && procType.contains("ENCRYPTED") && header(DEK_INFO_HEADER) != null;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PemBlock)) {
      return false;
    }
    final var other = (PemBlock) o;
    return type.equals(other.type) && headers.equals(other.headers) && Arrays.equals(content, other.content);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * type.hashCode() + headers.hashCode()) + Arrays.hashCode(content);
  }

  @Override
  public String toString() {
    return "PemBlock{type='" + type + "', headers=" + headers.keySet() + ", length=" + content.length + '}';
  }
}
