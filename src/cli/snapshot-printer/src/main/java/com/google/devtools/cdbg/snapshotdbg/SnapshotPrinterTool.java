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

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.logging.LogManager;

/**
 * Command line utility to print the data of a snapshot saved as a JSON file.
 *
 * <p>Syntax: SnapshotPrinterTool <file> [frame index]
 *
 * <p>The maximum expansion level comes from the com.google.cdbg.max_level system property, the
 * SNAPSHOT_DBG_MAX_LEVEL environment variable or the configuration file.
 */
public final class SnapshotPrinterTool {
  public static void main(String[] args) throws Exception {
    if (args.length < 1 || args.length > 2) {
      throw new IllegalArgumentException("Require 1 or 2 arguments");
    }

    // Diagnostic messages go to stderr, only warnings and above unless overridden with
    // -Djava.util.logging.config.file.
    if (System.getProperty("java.util.logging.config.file") == null) {
      try (InputStream config =
          SnapshotPrinterTool.class.getResourceAsStream("/logging.properties")) {
        if (config != null) {
          LogManager.getLogManager().readConfiguration(config);
        }
      }
    }

    int frameIndex = (args.length == 2) ? Integer.parseInt(args[1]) : 0;
    if (frameIndex < 0) {
      throw new IllegalArgumentException("Invalid stack frame index: " + args[1]);
    }

    String json = new String(Files.readAllBytes(Paths.get(args[0])), UTF_8);
    Snapshot snapshot = SnapshotDocument.parse(json);
    SnapshotParser parser = new SnapshotParser(snapshot, CliEnvironment.getMaxExpansionLevel());

    if (frameIndex > 0 && frameIndex >= parser.getStackFrames().size()) {
      throw new IllegalArgumentException(
          String.format(
              "Stack frame index %d too big, there are only %d stack frames.",
              frameIndex, parser.getStackFrames().size()));
    }

    System.out.println("Status: " + parser.getStatusText());

    if (frameIndex == 0) {
      System.out.println("Evaluated Expressions:");
      System.out.println(SnapshotDocument.toJson(parser.parseExpressions(), true));
    }

    System.out.println("Local Variables For Stack Frame Index " + frameIndex + ":");
    System.out.println(SnapshotDocument.toJson(parser.parseLocals(frameIndex), true));

    if (frameIndex == 0) {
      System.out.println("CallStack:");
      System.out.println(SnapshotDocument.toJson(parser.parseCallStack(), true));
    }
  }
}
