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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Captured snapshot as stored in the Firebase RTDB breakpoint schema.
 *
 * <p>Note, these classes are populated automatically by Gson from the breakpoint JSON document. To
 * support this the following is purposely done here:
 *
 * <ol>
 *   <li>All data members are public and every class has a default constructor.
 *   <li>Absent JSON fields are left null, which is how "field not present" is told apart from an
 *       empty value.
 * </ol>
 */
public class Snapshot {
  public String id;
  public String action;
  public SourceLocation location;
  public String condition;
  public List<String> expressions;
  public Boolean isFinalState;
  public Status status;
  public List<StackFrame> stackFrames;
  public List<Variable> variableTable;
  public List<Variable> evaluatedExpressions;
  public Long createTimeUnixMsec;
  public Long finalTimeUnixMsec;
  public String userEmail;

  public List<StackFrame> getStackFrames() {
    return (stackFrames == null) ? Collections.<StackFrame>emptyList() : stackFrames;
  }

  public List<Variable> getVariableTable() {
    return (variableTable == null) ? Collections.<Variable>emptyList() : variableTable;
  }

  public List<Variable> getEvaluatedExpressions() {
    return (evaluatedExpressions == null)
        ? Collections.<Variable>emptyList()
        : evaluatedExpressions;
  }

  public boolean getIsFinalState() {
    return Boolean.TRUE.equals(isFinalState);
  }

  /** Source file path and line number. */
  public static class SourceLocation {
    public String path;
    public Integer line;

    public SourceLocation() {}

    public SourceLocation(String path, Integer line) {
      this.path = path;
      this.line = line;
    }
  }

  /** Status message attached to a breakpoint or to a captured variable. */
  public static class Status {
    public Description description;
    public Boolean isError;
    public String refersTo;

    /** Format string with $N placeholders plus the parameters substituting them. */
    public static class Description {
      public String format;
      public List<String> parameters;
    }
  }

  /** One frame of the captured call stack. */
  public static class StackFrame {
    public String function;
    public SourceLocation location;
    public List<Variable> arguments;
    public List<Variable> locals;

    /** Returns the frame arguments followed by its locals. */
    public List<Variable> getArgumentsAndLocals() {
      List<Variable> variables = new ArrayList<>();
      if (arguments != null) {
        variables.addAll(arguments);
      }
      if (locals != null) {
        variables.addAll(locals);
      }
      return variables;
    }
  }

  /**
   * Captured variable. It is either a leaf value, an inline composite with members, or a reference
   * into the snapshot's variable table through {@code varTableIndex}.
   */
  public static class Variable {
    public String name;
    public Object value;
    public Integer varTableIndex;
    public List<Variable> members;
    public String type;
    public Status status;

    public String getName() {
      return (name == null) ? "" : name;
    }

    public List<Variable> getMembers() {
      return (members == null) ? Collections.<Variable>emptyList() : members;
    }

    /**
     * Returns a new variable combining this one with the variable table entry it refers to. Fields
     * present in the table entry take precedence over the fields of this variable.
     */
    Variable mergedWith(Variable tableEntry) {
      Variable merged = new Variable();
      merged.name = (tableEntry.name != null) ? tableEntry.name : name;
      merged.value = (tableEntry.value != null) ? tableEntry.value : value;
      merged.varTableIndex =
          (tableEntry.varTableIndex != null) ? tableEntry.varTableIndex : varTableIndex;
      merged.members = (tableEntry.members != null) ? tableEntry.members : members;
      merged.type = (tableEntry.type != null) ? tableEntry.type : type;
      merged.status = (tableEntry.status != null) ? tableEntry.status : status;
      return merged;
    }
  }
}
