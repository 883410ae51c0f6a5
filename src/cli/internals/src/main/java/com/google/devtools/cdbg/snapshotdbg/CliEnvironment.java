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

import static com.google.devtools.cdbg.snapshotdbg.CliLogger.info;
import static com.google.devtools.cdbg.snapshotdbg.CliLogger.warnfmt;
import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * Configuration of the command line client.
 *
 * <p>Each setting is read from a system property, falling back to an environment variable, and for
 * some settings to the YAML configuration file.
 */
public final class CliEnvironment {

  /** Private constructor; class should not be instantiated. */
  private CliEnvironment() {}

  /** Wrapper interface for getEnv to facilitate testing. */
  public static interface EnvironmentStore {
    public String get(String name);
  }

  /** Default system environmentStore implementation */
  private static class SystemEnvironmentStore implements EnvironmentStore {
    @Override
    public String get(String name) {
      return System.getenv(name);
    }
  }

  /** The environment variable store. Public for testing. */
  public static EnvironmentStore environmentStore = new SystemEnvironmentStore();

  /** Cached configuration file. Visible for testing. */
  static CliConfigParser config = null;

  /**
   * Lazily loads and returns the configuration file.
   *
   * @return the parsed configuration, empty if no configuration file is set
   * @throws IOException if the configuration file can't be read
   * @throws CliConfigParserException if the configuration file is not valid
   */
  static synchronized CliConfigParser getConfig() throws IOException, CliConfigParserException {
    // Lazy initialization.
    if (config == null) {
      String configFile = getFlag("config_file", "SNAPSHOT_DBG_CONFIG");
      if (configFile.isEmpty()) {
        config = new CliConfigParser("");
      } else {
        info("Using configuration file " + configFile);
        config = new CliConfigParser(new String(Files.readAllBytes(Paths.get(configFile)), UTF_8));
      }
    }

    return config;
  }

  /**
   * Gets the maximum variable expansion level.
   *
   * <p>An explicit flag takes precedence over the configuration file. A flag that isn't a non
   * negative integer is ignored.
   */
  public static int getMaxExpansionLevel() throws IOException, CliConfigParserException {
    String flag = getFlag("max_level", "SNAPSHOT_DBG_MAX_LEVEL");
    if (!flag.isEmpty()) {
      try {
        int maxLevel = Integer.parseInt(flag.trim());
        if (maxLevel >= 0) {
          return maxLevel;
        }
        warnfmt("Ignoring negative max_level flag '%s'", flag);
      } catch (NumberFormatException e) {
        warnfmt("Ignoring invalid max_level flag '%s': %s", flag, e.getMessage());
      }
    }

    Integer configured = getConfig().getMaxExpansionLevel();
    return (configured == null) ? VariableResolver.DEFAULT_MAX_EXPANSION_LEVEL : configured;
  }

  /** Gets the log level used for new logpoints when the user doesn't specify one. */
  public static LogLevel getDefaultLogLevel() throws IOException, CliConfigParserException {
    LogLevel configured = getConfig().getLogLevel();
    return (configured == null) ? LogLevel.INFO : configured;
  }

  /** Gets configuration flag from a system property falling back to an environment variable. */
  private static String getFlag(String systemPropertySuffix, String environmentVariable) {
    String value = System.getProperty("com.google.cdbg." + systemPropertySuffix);
    if (value != null) {
      return value;
    }

    value = environmentStore.get(environmentVariable);
    if (value != null) {
      return value;
    }

    return ""; // Return empty string so that we don't need to check for null references.
  }
}
