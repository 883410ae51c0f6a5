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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.IllegalFormatException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Static class to log diagnostic messages.
 *
 * <p>All messages go through a single {@code java.util.logging} logger so that the host
 * application (or the printer tool) decides where they end up. None of the methods throw, a
 * message that can't be formatted is logged in a slightly different form instead.
 */
public final class CliLogger {
  /** Name of the logger all diagnostic messages are sent to. */
  public static final String LOGGER_NAME = "com.google.cdbg.cli";

  private static final Logger logger = Logger.getLogger(LOGGER_NAME);

  private CliLogger() {}

  public static Logger getLogger() {
    return logger;
  }

  public static void info(String message) {
    logger.log(Level.INFO, message);
  }

  public static void warn(String message) {
    logger.log(Level.WARNING, message);
  }

  public static void severe(String message) {
    logger.log(Level.SEVERE, message);
  }

  public static void infofmt(Throwable thrown, String message, Object... args) {
    if (logger.isLoggable(Level.INFO)) {
      info(formatSafely(thrown, message, args));
    }
  }

  public static void warnfmt(Throwable thrown, String message, Object... args) {
    if (logger.isLoggable(Level.WARNING)) {
      warn(formatSafely(thrown, message, args));
    }
  }

  public static void severefmt(Throwable thrown, String message, Object... args) {
    if (logger.isLoggable(Level.SEVERE)) {
      severe(formatSafely(thrown, message, args));
    }
  }

  public static void infofmt(String message, Object... args) {
    if (logger.isLoggable(Level.INFO)) {
      info(formatSafely(message, args));
    }
  }

  public static void warnfmt(String message, Object... args) {
    if (logger.isLoggable(Level.WARNING)) {
      warn(formatSafely(message, args));
    }
  }

  public static void severefmt(String message, Object... args) {
    if (logger.isLoggable(Level.SEVERE)) {
      severe(formatSafely(message, args));
    }
  }

  /**
   * Safely formats a message string with exception and guarantees not to throw an exception, but
   * instead returns a slightly different message.
   *
   * @param thrown exception to format
   * @param fmt the format string
   * @param args array of parameters for the format string
   */
  static String formatSafely(Throwable thrown, String fmt, Object... args) {
    return formatSafely(fmt, args) + "\n" + formatSafely(thrown);
  }

  /**
   * Safely formats a string with {@link String#format(String, Object[])}, and guarantees not to
   * throw an exception, but instead returns a slightly different message.
   *
   * @param fmt the format string
   * @param args array of parameters for the format string
   */
  static String formatSafely(String fmt, Object... args) {
    try {
      try {
        return String.format(fmt, args);
      } catch (IllegalFormatException e) {
        return String.format(
            "Failed to format message: \"%s\", args: %s",
            fmt, (args != null) ? Arrays.toString(args) : "null");
      }
    } catch (Exception e) {
      // such as a failure during toString() on one of the arguments
      return String.format("Failed to format message: \"%s\"", fmt);
    }
  }

  /**
   * Safely formats the exception with call stack and guarantees not to throw an exception, but
   * instead returns a slightly different message.
   *
   * @param thrown exception to format
   */
  static String formatSafely(Throwable thrown) {
    try {
      StringWriter stringWriter = new StringWriter();
      PrintWriter printWriter = new PrintWriter(stringWriter);
      thrown.printStackTrace(printWriter);
      printWriter.flush();
      return stringWriter.toString();
    } catch (Exception e) {
      return "Failed to format thrown exception";
    }
  }
}
