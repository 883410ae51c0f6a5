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

import java.util.Collections;
import java.util.List;

/**
 * Human readable version of a status message.
 *
 * <p>Status messages may appear in a breakpoint, a debuggee or a captured variable. The message
 * format uses $N placeholders (N being a single digit) that are substituted with the message
 * parameters, and $$ to escape a literal $.
 */
public final class StatusMessage {
  /** Decoder used by default to render variable status messages. */
  public static final StatusMessageDecoder DECODER =
      new StatusMessageDecoder() {
        @Override
        public String decode(Snapshot.Status status) {
          return StatusMessage.of(status).getParsedMessage();
        }
      };

  private static final StatusMessage NONE = new StatusMessage(null, null, null);

  private final String parsedMessage;
  private final Boolean isError;
  private final String refersTo;

  private StatusMessage(String parsedMessage, Boolean isError, String refersTo) {
    this.parsedMessage = parsedMessage;
    this.isError = isError;
    this.refersTo = refersTo;
  }

  /**
   * Parses the status message.
   *
   * @param status status message, null if the parent had none
   * @return parsed message, all of its fields are null if {@code status} is null
   */
  public static StatusMessage of(Snapshot.Status status) {
    if (status == null) {
      return NONE;
    }

    return new StatusMessage(
        parseMessage(status.description),
        Boolean.TRUE.equals(status.isError),
        status.refersTo);
  }

  /** Gets the message text, null if there was no status or it had no format string. */
  public String getParsedMessage() {
    return parsedMessage;
  }

  /** Gets the error flag, null if there was no status. */
  public Boolean getIsError() {
    return isError;
  }

  /**
   * Gets what the message refers to, such as BREAKPOINT_CONDITION, BREAKPOINT_EXPRESSION,
   * VARIABLE_NAME, VARIABLE_VALUE, BREAKPOINT_SOURCE_LOCATION, BREAKPOINT_AGE or UNSPECIFIED.
   */
  public String getRefersTo() {
    return refersTo;
  }

  private static String parseMessage(Snapshot.Status.Description description) {
    if (description == null || description.format == null) {
      return null;
    }

    String format = description.format;
    List<String> parameters =
        (description.parameters == null)
            ? Collections.<String>emptyList()
            : description.parameters;

    StringBuilder output = new StringBuilder();
    int i = 0;
    while (i < format.length()) {
      char c = format.charAt(i);
      if (c != '$' || i + 1 == format.length()) {
        output.append(c);
        i++;
        continue;
      }

      char next = format.charAt(i + 1);
      if (next == '$') {
        output.append('$');
        i += 2;
      } else if (next >= '0' && next <= '9' && (next - '0') < parameters.size()) {
        output.append(parameters.get(next - '0'));
        i += 2;
      } else {
        // Unknown or out of range placeholder, keep it verbatim.
        output.append('$');
        i++;
      }
    }

    return output.toString();
  }
}
