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

import com.google.common.collect.ImmutableList;
import com.google.devtools.cdbg.snapshotdbg.Snapshot.StackFrame;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parses the data of a captured snapshot so it can be presented to the user.
 *
 * <p>An instance wraps a single snapshot and is not meant to outlive the command that displays
 * it.
 */
public final class SnapshotParser {
  /** Displayed in place of a missing function name or location. */
  static final String UNKNOWN = "unknown";

  /** Status message that doesn't indicate a failure even when flagged as an error. */
  private static final String REFERS_TO_BREAKPOINT_AGE = "BREAKPOINT_AGE";

  private final Snapshot snapshot;
  private final VariableResolver variableResolver;
  private final StatusMessage statusMessage;

  public SnapshotParser(Snapshot snapshot, int maxExpansionLevel) {
    this(
        snapshot,
        new VariableResolver(
            Objects.requireNonNull(snapshot).getVariableTable(), maxExpansionLevel));
  }

  /** Class constructor. Visible for testing. */
  SnapshotParser(Snapshot snapshot, VariableResolver variableResolver) {
    this.snapshot = Objects.requireNonNull(snapshot);
    this.variableResolver = variableResolver;
    this.statusMessage = StatusMessage.of(snapshot.status);
  }

  public List<StackFrame> getStackFrames() {
    return snapshot.getStackFrames();
  }

  /** Gets the snapshot level status message. Its fields are null if there was none. */
  public StatusMessage getStatusMessage() {
    return statusMessage;
  }

  /** Resolves the evaluated expressions. */
  public List<Map<String, Object>> parseExpressions() {
    return variableResolver.resolveExpressions(snapshot.getEvaluatedExpressions());
  }

  /**
   * Resolves the arguments and locals of a stack frame.
   *
   * @param stackFrameIndex index of the frame, 0 being the top of the stack
   * @return the resolved variables, empty if the index is out of range
   */
  public List<Map<String, Object>> parseLocals(int stackFrameIndex) {
    List<StackFrame> stackFrames = snapshot.getStackFrames();
    if (stackFrameIndex < 0 || stackFrameIndex >= stackFrames.size()) {
      return new ArrayList<>();
    }

    return variableResolver.resolveLocals(stackFrames.get(stackFrameIndex));
  }

  /** Returns one [function, file:line] row per stack frame. */
  public List<ImmutableList<String>> parseCallStack() {
    List<ImmutableList<String>> callStack = new ArrayList<>();

    for (StackFrame frame : snapshot.getStackFrames()) {
      String function = (frame.function == null) ? UNKNOWN : frame.function;
      String location = BreakpointUtils.transformLocationToFileLine(frame.location);
      callStack.add(ImmutableList.of(function, (location == null) ? UNKNOWN : location));
    }

    return callStack;
  }

  /**
   * Gets the status line displayed in the snapshot summary.
   *
   * <p>It is 'Complete' or 'Active' unless the snapshot carries a status message, in which case
   * the message is used. Errors are prefixed with 'ERROR:', except for the expiration of the
   * snapshot which is reported as an error by the agents but is a normal outcome.
   */
  public String getStatusText() {
    String message = statusMessage.getParsedMessage();
    if (message == null) {
      return snapshot.getIsFinalState() ? "Complete" : "Active";
    }

    if (Boolean.TRUE.equals(statusMessage.getIsError())
        && !REFERS_TO_BREAKPOINT_AGE.equals(statusMessage.getRefersTo())) {
      return String.format("ERROR: %s (refers to: %s)", message, statusMessage.getRefersTo());
    }

    return message;
  }
}
