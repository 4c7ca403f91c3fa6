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

import dev.knative.eventing.kafka.clientauth.errors.PemParseException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import javax.annotation.Nullable;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.io.pem.PemHeader;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;
import org.bouncycastle.util.io.pem.PemWriter;

public class PemDecoder {

  private PemDecoder() {
  }

  /**
   * Decode the first PEM block found in {@code bytes}. Text before the first block is skipped.
   *
   * @return the first block, or null when the input has no PEM block at all.
   * @throws PemParseException when a block is found but is malformed.
   */
  @Nullable
  public static PemBlock decode(final byte[] bytes) {
    try (final var reader = reader(bytes)) {
      final var object = reader.readPemObject();
      return object == null ? null : toBlock(object);
    } catch (final IOException | DecoderException ex) {
      throw new PemParseException("malformed PEM block: " + ex.getMessage(), ex);
    }
  }

  /**
   * Decode every PEM block found in {@code bytes}, in order.
   *
   * @throws PemParseException when any block is malformed.
   */
  public static List<PemBlock> decodeAll(final byte[] bytes) {
    final var blocks = new ArrayList<PemBlock>();
    try (final var reader = reader(bytes)) {
      PemObject object;
      while ((object = reader.readPemObject()) != null) {
        blocks.add(toBlock(object));
      }
    } catch (final IOException | DecoderException ex) {
      throw new PemParseException("malformed PEM block: " + ex.getMessage(), ex);
    }
    return blocks;
  }

  /**
   * Encode a block back to its textual PEM form, headers included.
   */
  public static byte[] encode(final PemBlock block) {
    final var headers = new ArrayList<PemHeader>(block.headers().size());
    block.headers().forEach((name, value) -> headers.add(new PemHeader(name, value)));

    final var out = new ByteArrayOutputStream();
    try (final var writer = new PemWriter(new OutputStreamWriter(out, StandardCharsets.US_ASCII))) {
      writer.writeObject(new PemObject(block.type(), headers, block.content()));
    } catch (final IOException ex) {
      // in-memory stream
      throw new UncheckedIOException(ex);
    }
    return out.toByteArray();
  }

  private static PemReader reader(final byte[] bytes) {
    return new PemReader(new InputStreamReader(new ByteArrayInputStream(bytes), StandardCharsets.US_ASCII));
  }

  private static PemBlock toBlock(final PemObject object) {
    final var headers = new LinkedHashMap<String, String>();
    for (final Object o : object.getHeaders()) {
      final var header = (PemHeader) o;
      headers.put(header.getName(), header.getValue());
    }
    return new PemBlock(object.getType(), headers, object.getContent());
  }
}
