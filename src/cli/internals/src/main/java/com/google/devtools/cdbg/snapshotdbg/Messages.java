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

final class Messages {
  public static final String VARIABLE_CYCLE =
      "DBG_MSG: Cycle, refers to same instance as ancestor field '%s'.";

  public static final String VARIABLE_CYCLE_ANCESTOR_UNKNOWN =
      "DBG_MSG: Cycle, refers to same instance as an ancestor field.";

  public static final String MAX_EXPANSION_LEVEL_HIT =
      "DBG_MSG: Max expansion level of %d hit. Specify a larger value for --max-level to see more.";

  /** Suffix of the sibling entry that carries a variable's status message. */
  public static final String DBG_MSG_SUFFIX = " - DBG_MSG";

  public static final String TOO_MANY_CLOSING_BRACES =
      "There are too many \"}\" characters in the log format string";

  public static final String TOO_MANY_OPENING_BRACES =
      "There are too many \"{\" characters in the log format string";

  public static final String INVALID_LOG_LEVEL = "Invalid log-level argument provided: %s";

  private Messages() {}
}
