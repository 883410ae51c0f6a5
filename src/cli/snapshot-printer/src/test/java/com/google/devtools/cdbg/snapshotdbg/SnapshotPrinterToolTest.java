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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.file.Files;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Unit tests for {@link SnapshotPrinterTool}. */
@RunWith(JUnit4.class)
public class SnapshotPrinterToolTest {
  private static final String SNAPSHOT =
      "{\"id\": \"b-1\", \"isFinalState\": true,"
          + " \"evaluatedExpressions\": [{\"name\": \"n\", \"value\": \"1\", \"type\": \"int\"}],"
          + " \"stackFrames\": ["
          + "   {\"function\": \"Main.run\", \"location\": {\"path\": \"Main.java\", \"line\": 5},"
          + "    \"locals\": [{\"name\": \"s\", \"value\": \"top\"}]},"
          + "   {\"function\": \"Main.main\", \"location\": {\"path\": \"Main.java\", \"line\": 9},"
          + "    \"locals\": [{\"name\": \"t\", \"value\": \"bottom\"}]}]}";

  @Rule public TemporaryFolder folder = new TemporaryFolder();

  private final ByteArrayOutputStream output = new ByteArrayOutputStream();
  private PrintStream oldOut;
  private String snapshotFile;

  @Before
  public void setUp() throws Exception {
    oldOut = System.out;
    System.setOut(new PrintStream(output, true, "UTF-8"));

    File file = folder.newFile("snapshot.json");
    Files.write(file.toPath(), SNAPSHOT.getBytes(UTF_8));
    snapshotFile = file.getPath();
  }

  @After
  public void cleanup() {
    System.setOut(oldOut);
  }

  private String printed() throws Exception {
    return output.toString("UTF-8");
  }

  @Test
  public void printTopFrame() throws Exception {
    SnapshotPrinterTool.main(new String[] {snapshotFile});

    String printed = printed();
    assertThat(printed).startsWith("Status: Complete" + System.lineSeparator());
    assertThat(printed).contains("Evaluated Expressions:");
    assertThat(printed).contains("\"n (int)\": \"1\"");
    assertThat(printed).contains("Local Variables For Stack Frame Index 0:");
    assertThat(printed).contains("\"s\": \"top\"");
    assertThat(printed).contains("CallStack:");
    assertThat(printed).contains("\"Main.java:9\"");
    assertThat(printed).doesNotContain("bottom");
  }

  @Test
  public void printOtherFrame() throws Exception {
    SnapshotPrinterTool.main(new String[] {snapshotFile, "1"});

    String printed = printed();
    assertThat(printed).contains("Local Variables For Stack Frame Index 1:");
    assertThat(printed).contains("\"t\": \"bottom\"");
    assertThat(printed).doesNotContain("Evaluated Expressions:");
    assertThat(printed).doesNotContain("CallStack:");
  }

  @Test
  public void frameIndexTooBig() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> SnapshotPrinterTool.main(new String[] {snapshotFile, "2"}));
    assertThat(e).hasMessageThat().contains("there are only 2 stack frames");
  }

  @Test
  public void wrongArgumentCount() {
    assertThrows(IllegalArgumentException.class, () -> SnapshotPrinterTool.main(new String[0]));
  }

  @Test
  public void invalidSnapshot() throws Exception {
    File file = folder.newFile("invalid.json");
    Files.write(file.toPath(), "[]".getBytes(UTF_8));

    assertThrows(
        SnapshotFormatException.class,
        () -> SnapshotPrinterTool.main(new String[] {file.getPath()}));
  }
}
