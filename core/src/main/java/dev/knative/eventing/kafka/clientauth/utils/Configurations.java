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

package dev.knative.eventing.kafka.clientauth.utils;

import dev.knative.eventing.kafka.clientauth.errors.ProfileConfigException;
import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static dev.knative.eventing.kafka.clientauth.utils.Logging.keyValue;

public class Configurations {

  private static final Logger logger = LoggerFactory.getLogger(Configurations.class);

  private Configurations() {
  }

  /**
   * Retrieve a properties file.
   * <p>
   * Note: this method is blocking, thus it shouldn't be called on the event loop.
   *
   * @throws ProfileConfigException when the file exists but cannot be loaded.
   */
  public static Properties readPropertiesSync(final String path) {
    if (path == null) {
      return new Properties();
    }

    final var props = new Properties();
    try (final var configReader = new FileReader(path, StandardCharsets.UTF_8)) {
      props.load(configReader);
    } catch (IOException e) {
      logger.error("failed to load configurations from file {}", keyValue("path", path), e);
      throw new ProfileConfigException("failed to load configurations from file " + path, e);
    }

    logger.debug("loaded configurations {} {}", keyValue("path", path), keyValue("keys", props.size()));
    return props;
  }

  /**
   * Parse a boolean flag, falling back to {@code defaultValue} when the value is missing or blank.
   */
  public static boolean asBoolean(final String value, final boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    if (value.trim().equalsIgnoreCase("true")) {
      return true;
    }
    if (value.trim().equalsIgnoreCase("false")) {
      return false;
    }
    throw new ProfileConfigException("invalid boolean value '" + value + "'");
  }
}
