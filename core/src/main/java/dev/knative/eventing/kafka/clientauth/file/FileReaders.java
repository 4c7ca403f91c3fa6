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

package dev.knative.eventing.kafka.clientauth.file;

import dev.knative.eventing.kafka.clientauth.errors.FileAccessException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static dev.knative.eventing.kafka.clientauth.utils.Logging.keyValue;

/**
 * Blocking file access for certificate, key and CA files.
 * <p>
 * Every handle is opened and closed within a single call.
 */
public class FileReaders {

  private static final Logger logger = LoggerFactory.getLogger(FileReaders.class);

  private FileReaders() {
  }

  /**
   * @return true if the file at the given path exists and can be opened for reading.
   */
  public static boolean canRead(final String path) {
    if (path == null || path.isBlank()) {
      return false;
    }
    try (final var ignored = Files.newInputStream(Path.of(path))) {
      return true;
    } catch (final IOException | InvalidPathException | SecurityException ex) {
      logger.debug("file is not readable {} {}", keyValue("path", path), keyValue("reason", ex.toString()));
      return false;
    }
  }

  /**
   * Read the whole file.
   *
   * @param path file path.
   * @param role what the file holds (certificate, key, CA file), used in the error message.
   * @return file content.
   * @throws FileAccessException if the file cannot be read.
   */
  public static byte[] readAll(final String path, final String role) {
    if (path == null || path.isBlank()) {
      throw new FileAccessException(path, "no path specified for " + role);
    }
    try {
      return Files.readAllBytes(Path.of(path));
    } catch (final IOException | InvalidPathException | SecurityException ex) {
      throw new FileAccessException(path, "cannot read " + role + " '" + path + "'", ex);
    }
  }
}
