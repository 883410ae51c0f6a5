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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Unit tests for {@link SnapshotDocument}. */
@RunWith(JUnit4.class)
public class SnapshotDocumentTest {

  @Test
  public void parse() throws Exception {
    Snapshot snapshot =
        SnapshotDocument.parse(
            "{\"id\": \"b-1\", \"isFinalState\": true, \"createTimeUnixMsec\": 1649962215426,"
                + " \"location\": {\"path\": \"Main.java\", \"line\": 26},"
                + " \"evaluatedExpressions\": [{\"name\": \"x\", \"value\": 5}]}");

    assertThat(snapshot.id).isEqualTo("b-1");
    assertThat(snapshot.getIsFinalState()).isTrue();
    assertThat(snapshot.createTimeUnixMsec).isEqualTo(1649962215426L);
    assertThat(snapshot.location.path).isEqualTo("Main.java");
    assertThat(snapshot.location.line).isEqualTo(26);
    assertThat(snapshot.getEvaluatedExpressions()).hasSize(1);
    assertThat(snapshot.getEvaluatedExpressions().get(0).value).isEqualTo(5L);
    assertThat(snapshot.getStackFrames()).isEmpty();
    assertThat(snapshot.getVariableTable()).isEmpty();
  }

  @Test
  public void parseUntypedNumbers() throws Exception {
    Snapshot snapshot =
        SnapshotDocument.parse(
            "{\"evaluatedExpressions\": [{\"value\": 1.25}, {\"value\": true}, {\"value\": 3}]}");

    assertThat(snapshot.evaluatedExpressions.get(0).value).isEqualTo(1.25);
    assertThat(snapshot.evaluatedExpressions.get(1).value).isEqualTo(true);
    assertThat(snapshot.evaluatedExpressions.get(2).value).isEqualTo(3L);
  }

  @Test
  public void parseIgnoresUnknownFields() throws Exception {
    Snapshot snapshot = SnapshotDocument.parse("{\"id\": \"b-1\", \"labels\": {\"a\": \"b\"}}");
    assertThat(snapshot.id).isEqualTo("b-1");
  }

  @Test
  public void parseInvalidJson() {
    assertThrows(SnapshotFormatException.class, () -> SnapshotDocument.parse("{\"id\": "));
  }

  @Test
  public void parseNonObject() {
    assertThrows(SnapshotFormatException.class, () -> SnapshotDocument.parse("[1, 2]"));
    assertThrows(SnapshotFormatException.class, () -> SnapshotDocument.parse("\"text\""));
  }

  @Test
  public void parseUnexpectedFieldType() {
    SnapshotFormatException e =
        assertThrows(
            SnapshotFormatException.class,
            () -> SnapshotDocument.parse("{\"stackFrames\": {\"function\": \"f\"}}"));
    assertThat(e).hasCauseThat().isNotNull();
  }

  @Test
  public void parseBreakpoint() throws Exception {
    Map<String, Object> breakpoint =
        SnapshotDocument.parseBreakpoint(
            "{\"id\": \"b-1\", \"location\": {\"path\": \"Main.java\", \"line\": 26}}");

    assertThat(breakpoint).containsEntry("id", "b-1");
    assertThat(breakpoint)
        .containsEntry("location", ImmutableMap.of("path", "Main.java", "line", 26L));
  }

  @Test
  public void parseBreakpointNonObject() {
    assertThrows(SnapshotFormatException.class, () -> SnapshotDocument.parseBreakpoint("null"));
  }

  @Test
  public void toJsonSerializesNulls() {
    Map<String, Object> value = new LinkedHashMap<>();
    value.put("x", null);
    value.put("y", 1L);

    assertThat(SnapshotDocument.toJson(value, false)).isEqualTo("{\"x\":null,\"y\":1}");
  }

  @Test
  public void toJsonPretty() {
    String json = SnapshotDocument.toJson(ImmutableMap.of("a < b (boolean)", true), true);

    assertThat(json).isEqualTo("{\n  \"a < b (boolean)\": true\n}");
  }
}
