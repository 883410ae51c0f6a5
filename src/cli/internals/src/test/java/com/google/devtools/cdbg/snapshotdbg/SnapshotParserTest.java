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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Resources;
import com.google.devtools.cdbg.snapshotdbg.Snapshot.StackFrame;
import com.google.devtools.cdbg.snapshotdbg.Snapshot.Status;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Unit tests for {@link SnapshotParser}. */
@RunWith(JUnit4.class)
public class SnapshotParserTest {
  private Snapshot snapshot;

  @Before
  public void setUp() throws Exception {
    snapshot =
        SnapshotDocument.parse(Resources.toString(Resources.getResource("snapshot.json"), UTF_8));
  }

  private static Status status(boolean isError, String refersTo, String format, String... params) {
    Status status = new Status();
    status.isError = isError;
    status.refersTo = refersTo;
    status.description = new Status.Description();
    status.description.format = format;
    status.description.parameters = ImmutableList.copyOf(params);
    return status;
  }

  @Test
  public void parseExpressions() {
    SnapshotParser parser = new SnapshotParser(snapshot, 3);

    assertThat(parser.parseExpressions()).containsExactly(ImmutableMap.of("a + b (int)", "3"));
  }

  @Test
  public void parseLocalsTopFrame() {
    SnapshotParser parser = new SnapshotParser(snapshot, 3);

    assertThat(parser.parseLocals(0))
        .containsExactly(
            ImmutableMap.of("args (String[])", ImmutableMap.of("[0] (String)", "hello")),
            ImmutableMap.of("count (int)", "2"),
            ImmutableMap.of(
                "self (com.example.Main)",
                ImmutableMap.of(
                    "owner", String.format(Messages.VARIABLE_CYCLE, "self"), "runs", 7L)))
        .inOrder();
  }

  @Test
  public void parseLocalsOtherFrames() {
    SnapshotParser parser = new SnapshotParser(snapshot, 3);

    assertThat(parser.parseLocals(1)).containsExactly(ImmutableMap.of("ratio", 1.5));
    assertThat(parser.parseLocals(2)).isEmpty();
  }

  @Test
  public void parseLocalsOutOfRange() {
    SnapshotParser parser = new SnapshotParser(snapshot, 3);

    assertThat(parser.parseLocals(3)).isEmpty();
    assertThat(parser.parseLocals(-1)).isEmpty();
  }

  @Test
  public void parseLocalsMaxLevelZero() {
    SnapshotParser parser =
        new SnapshotParser(snapshot, new VariableResolver(snapshot.variableTable, 0));

    assertThat(parser.parseLocals(0).get(0))
        .containsExactly(
            "args (String[])",
            ImmutableMap.of("[0]", String.format(Messages.MAX_EXPANSION_LEVEL_HIT, 0)));
  }

  @Test
  public void parseCallStack() {
    SnapshotParser parser = new SnapshotParser(snapshot, 3);

    assertThat(parser.parseCallStack())
        .containsExactly(
            ImmutableList.of("com.example.Main.run", "com/example/Main.java:26"),
            ImmutableList.of("com.example.Main.main", "com/example/Main.java:10"),
            ImmutableList.of("unknown", "unknown"))
        .inOrder();
  }

  @Test
  public void parseCallStackPartialLocation() {
    StackFrame frame = new StackFrame();
    frame.function = "f";
    frame.location = new Snapshot.SourceLocation("a.java", null);
    snapshot.stackFrames = ImmutableList.of(frame);

    assertThat(new SnapshotParser(snapshot, 3).parseCallStack())
        .containsExactly(ImmutableList.of("f", "unknown"));
  }

  @Test
  public void nullSnapshot() {
    assertThrows(NullPointerException.class, () -> new SnapshotParser(null, 3));
  }

  @Test
  public void emptySnapshot() {
    SnapshotParser parser = new SnapshotParser(new Snapshot(), 3);

    assertThat(parser.parseExpressions()).isEmpty();
    assertThat(parser.parseLocals(0)).isEmpty();
    assertThat(parser.parseCallStack()).isEmpty();
    assertThat(parser.getStatusMessage().getParsedMessage()).isNull();
    assertThat(parser.getStatusText()).isEqualTo("Active");
  }

  @Test
  public void statusTextComplete() {
    assertThat(new SnapshotParser(snapshot, 3).getStatusText()).isEqualTo("Complete");
  }

  @Test
  public void statusTextError() {
    snapshot.status =
        status(true, "BREAKPOINT_CONDITION", "Expression $0 not valid: $1", "x >", "syntax");

    assertThat(new SnapshotParser(snapshot, 3).getStatusText())
        .isEqualTo("ERROR: Expression x > not valid: syntax (refers to: BREAKPOINT_CONDITION)");
  }

  @Test
  public void statusTextExpired() {
    snapshot.status = status(true, "BREAKPOINT_AGE", "The snapshot has expired");

    assertThat(new SnapshotParser(snapshot, 3).getStatusText())
        .isEqualTo("The snapshot has expired");
  }

  @Test
  public void statusTextInformational() {
    snapshot.isFinalState = false;
    snapshot.status = status(false, "UNSPECIFIED", "Waiting for the agent");

    assertThat(new SnapshotParser(snapshot, 3).getStatusText()).isEqualTo("Waiting for the agent");
  }

  @Test
  public void statusMessage() {
    snapshot.status = status(true, "BREAKPOINT_SOURCE_LOCATION", "No code found at line $0", "26");

    StatusMessage message = new SnapshotParser(snapshot, 3).getStatusMessage();
    assertThat(message.getParsedMessage()).isEqualTo("No code found at line 26");
    assertThat(message.getIsError()).isTrue();
    assertThat(message.getRefersTo()).isEqualTo("BREAKPOINT_SOURCE_LOCATION");
  }
}
