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

/**
 * Logging level of the messages emitted by a logpoint.
 *
 * <p>The breakpoint data consumed by the agents uses upper case names, users enter lower case
 * names.
 */
public enum LogLevel {
  INFO,
  WARNING,
  ERROR;

  /**
   * Parses a user supplied log level.
   *
   * @param logLevel one of "info", "warning" or "error"
   * @throws IllegalArgumentException if the log level is not recognized
   */
  public static LogLevel parse(String logLevel) {
    if (logLevel != null) {
      switch (logLevel) {
        case "info":
          return INFO;
        case "warning":
          return WARNING;
        case "error":
          return ERROR;
        default:
          break;
      }
    }

    throw new IllegalArgumentException(String.format(Messages.INVALID_LOG_LEVEL, logLevel));
  }
}
