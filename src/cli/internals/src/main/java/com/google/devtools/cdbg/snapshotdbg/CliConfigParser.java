/*
 * Copyright 2022 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.devtools.cdbg.snapshotdbg;

import static com.google.devtools.cdbg.snapshotdbg.CliLogger.infofmt;
import static com.google.devtools.cdbg.snapshotdbg.CliLogger.warnfmt;
import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/** Loads and parses the command line client configuration file. */
public class CliConfigParser {
  /** Maximum variable expansion level, null if not configured. */
  private Integer maxExpansionLevel;

  /** Default log level of new logpoints, null if not configured. */
  private LogLevel logLevel;

  /**
   * Parses the given YAML configuration.
   *
   * <p>Throws CliConfigParserException if the configuration can not be parsed or if it has an
   * unexpected structure.
   *
   * <p>An example of legal structure would be:
   *
   * <pre>
   *   max_level: 5
   *   log_level: warning
   * </pre>
   *
   * <p>Both keys are optional, and an empty config is also legal.
   */
  public CliConfigParser(String yamlConfig) throws CliConfigParserException {
    try (InputStream inputStream = new ByteArrayInputStream(yamlConfig.getBytes(UTF_8))) {
      parseYaml(inputStream);
    } catch (CliConfigParserException e) {
      warnfmt("%s", e.toString());
      throw e;
    } catch (IOException e) {
      // IOException is not expected on a string reader, but the API contract
      // requires we catch it anyway.
      warnfmt("%s", e.toString());
      throw new CliConfigParserException("IOException: " + e);
    }

    infofmt("Config Load OK. max_level: %s, log_level: %s", maxExpansionLevel, logLevel);
  }

  /** Returns the configured maximum expansion level, or null if not set. */
  public Integer getMaxExpansionLevel() {
    return maxExpansionLevel;
  }

  /** Returns the configured default log level, or null if not set. */
  public LogLevel getLogLevel() {
    return logLevel;
  }

  /**
   * Parses the given InputStream as YAML with an expected structure.
   *
   * <p>Throws CliConfigParserException if the stream can not be parsed or if it has an unexpected
   * structure.
   */
  private void parseYaml(InputStream yamlConfig) throws CliConfigParserException {
    Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));

    try {
      // We always expect a Map<String, Object>. Invalid cast is handled in the catch clause.
      @SuppressWarnings("unchecked")
      Map<String, Object> data = (Map<String, Object>) yaml.load(yamlConfig);

      if (data == null) {
        // Nothing was loaded
        return;
      }

      for (Map.Entry<String, Object> entry : data.entrySet()) {
        Object value = entry.getValue();

        switch (String.valueOf(entry.getKey())) {
          case "max_level":
            maxExpansionLevel = parseMaxExpansionLevel(value);
            break;
          case "log_level":
            logLevel = parseLogLevel(value);
            break;
          default:
            throw new CliConfigParserException("Unrecognized key in config: " + entry.getKey());
        }
      }
    } catch (YAMLException | ClassCastException e) {
      // Yaml failed to parse
      throw new CliConfigParserException(e.toString());
    }
  }

  private static Integer parseMaxExpansionLevel(Object value) throws CliConfigParserException {
    if (!(value instanceof Integer) || (Integer) value < 0) {
      throw new CliConfigParserException("max_level must be a non negative integer: " + value);
    }

    return (Integer) value;
  }

  private static LogLevel parseLogLevel(Object value) throws CliConfigParserException {
    try {
      return LogLevel.parse((value instanceof String) ? (String) value : null);
    } catch (IllegalArgumentException e) {
      throw new CliConfigParserException(e.getMessage());
    }
  }
}
