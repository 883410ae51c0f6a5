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

import static com.google.devtools.cdbg.snapshotdbg.CliLogger.warnfmt;

import com.google.devtools.cdbg.snapshotdbg.Snapshot.StackFrame;
import com.google.devtools.cdbg.snapshotdbg.Snapshot.Variable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves captured variables into nested name to value mappings that can be displayed to the
 * user.
 *
 * <p>Captured variables may refer to entries of the snapshot's variable table, and those entries
 * may in turn have members referring to other entries. The resulting graph can share nodes and can
 * have cycles (for instance an object that holds a reference to its parent). The expansion is
 * bounded by the maximum expansion level, and a reference back to a table entry that is already
 * being expanded on the current path is reported as a cycle instead of being expanded again. The
 * same entry reached from two different branches is expanded on both.
 *
 * <p>Snapshots are produced by agents of varying versions and languages, so the resolver never
 * throws on malformed data. Missing fields fall back to default values.
 *
 * <p>Each resolved variable is returned as a single entry map {@code {displayName: value}}, where
 * the value is either the captured scalar or a nested ordered map of the members. Variables that
 * carry a status message get a sibling entry {@code {"<displayName> - DBG_MSG": message}}.
 */
public final class VariableResolver {
  /** Default maximum expansion level. */
  public static final int DEFAULT_MAX_EXPANSION_LEVEL = 3;

  /** Shared variable table of the snapshot. */
  private final List<Variable> variableTable;

  /** Members deeper than this level are not expanded. */
  private final int maxExpansionLevel;

  /** Renders status messages attached to variables. */
  private final StatusMessageDecoder statusMessageDecoder;

  /** Result of resolving a single variable. */
  private static final class ResolvedVariable {
    final String name;
    final Object value;

    /** Status message of the variable, null if there was none. */
    final String message;

    ResolvedVariable(String name, Object value, String message) {
      this.name = name;
      this.value = value;
      this.message = message;
    }
  }

  public VariableResolver(List<Variable> variableTable, int maxExpansionLevel) {
    this(variableTable, maxExpansionLevel, StatusMessage.DECODER);
  }

  /**
   * Class constructor.
   *
   * @param variableTable the snapshot's variable table, null is treated as empty
   * @param maxExpansionLevel maximum level of members to expand, level 0 being the top level
   *     variables
   * @param statusMessageDecoder renders the status messages attached to variables
   */
  public VariableResolver(
      List<Variable> variableTable,
      int maxExpansionLevel,
      StatusMessageDecoder statusMessageDecoder) {
    if (maxExpansionLevel < 0) {
      throw new IllegalArgumentException(
          "Maximum expansion level must not be negative: " + maxExpansionLevel);
    }

    this.variableTable =
        (variableTable == null) ? Collections.<Variable>emptyList() : variableTable;
    this.maxExpansionLevel = maxExpansionLevel;
    this.statusMessageDecoder = statusMessageDecoder;
  }

  public int getMaxExpansionLevel() {
    return maxExpansionLevel;
  }

  /** Resolves the evaluated expressions of a snapshot. */
  public List<Map<String, Object>> resolveExpressions(List<Variable> expressions) {
    return resolveVariables(expressions);
  }

  /** Resolves the arguments followed by the locals of a stack frame. */
  public List<Map<String, Object>> resolveLocals(StackFrame stackFrame) {
    if (stackFrame == null) {
      return new ArrayList<>();
    }

    return resolveVariables(stackFrame.getArgumentsAndLocals());
  }

  /**
   * Resolves each variable at the top level.
   *
   * @param variables variables to resolve, null is treated as empty
   * @return one single entry map per variable, each followed by a status message entry if the
   *     variable had one
   */
  public List<Map<String, Object>> resolveVariables(List<Variable> variables) {
    List<Map<String, Object>> resolved = new ArrayList<>();
    if (variables == null) {
      return resolved;
    }

    for (Variable variable : variables) {
      // The ancestors are tracked per top level variable, nothing carries over between them.
      ResolvedVariable result = resolveVariable(variable, 0, new HashMap<Integer, String>());
      resolved.add(Collections.singletonMap(result.name, result.value));
      if (result.message != null) {
        resolved.add(
            Collections.<String, Object>singletonMap(
                result.name + Messages.DBG_MSG_SUFFIX, result.message));
      }
    }

    return resolved;
  }

  /**
   * Resolves a variable and, recursively, its members.
   *
   * @param variable the variable to resolve
   * @param level expansion level of the variable, 0 for top level variables
   * @param ancestors variable table indexes currently being expanded on the path from the top level
   *     variable, mapped to the name of the variable that referred to them
   */
  private ResolvedVariable resolveVariable(
      Variable variable, int level, Map<Integer, String> ancestors) {
    if (variable == null) {
      variable = new Variable();
    }

    if (level > maxExpansionLevel) {
      return new ResolvedVariable(
          variable.getName(), String.format(Messages.MAX_EXPANSION_LEVEL_HIT, maxExpansionLevel),
          null);
    }

    Integer varTableIndex = variable.varTableIndex;
    if (varTableIndex != null) {
      if (ancestors.containsKey(varTableIndex)) {
        String ancestorName = ancestors.get(varTableIndex);
        String cycleMessage =
            (ancestorName == null || ancestorName.isEmpty())
                ? Messages.VARIABLE_CYCLE_ANCESTOR_UNKNOWN
                : String.format(Messages.VARIABLE_CYCLE, ancestorName);
        return new ResolvedVariable(variable.getName(), cycleMessage, null);
      }

      ancestors.put(varTableIndex, variable.getName());
      Variable tableEntry = getTableEntry(varTableIndex);
      if (tableEntry != null) {
        variable = variable.mergedWith(tableEntry);
      }
    }

    List<Variable> members = variable.getMembers();
    String name = getDisplayName(variable, members);
    String message = statusMessageDecoder.decode(variable.status);

    Object value;
    if (!members.isEmpty()) {
      Map<String, Object> resolvedMembers = new LinkedHashMap<>();
      for (Variable member : members) {
        ResolvedVariable resolvedMember = resolveVariable(member, level + 1, ancestors);
        resolvedMembers.put(resolvedMember.name, resolvedMember.value);
        if (resolvedMember.message != null) {
          resolvedMembers.put(
              resolvedMember.name + Messages.DBG_MSG_SUFFIX, resolvedMember.message);
        }
      }
      value = resolvedMembers;
    } else if (variable.value != null) {
      value = variable.value;
    } else {
      // An empty string for a plain variable, null for a reference that had nothing to show.
      value = (varTableIndex == null) ? "" : null;
    }

    if (varTableIndex != null) {
      ancestors.remove(varTableIndex);
    }

    return new ResolvedVariable(name, value, message);
  }

  /** Returns the variable table entry, or null if the index is out of range. */
  private Variable getTableEntry(int index) {
    if (index < 0 || index >= variableTable.size()) {
      warnfmt(
          "Variable table index %d out of range, the table has %d entries",
          index, variableTable.size());
      return null;
    }

    return variableTable.get(index);
  }

  /**
   * Builds the name displayed for a variable, which includes its type when known.
   *
   * <p>Some agents (Node.js) report the type of a composite variable in its 'value' field.
   */
  private static String getDisplayName(Variable variable, List<Variable> members) {
    String name = variable.getName();

    if (variable.type != null) {
      return name + " (" + variable.type + ")";
    }

    if (variable.value != null && !members.isEmpty()) {
      return name + " (" + variable.value + ")";
    }

    return name;
  }
}
