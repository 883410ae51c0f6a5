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

/**
 * Turns a status message into human readable text. Provided as an interface so that the
 * {@link VariableResolver} can be tested with a mock decoder.
 */
public interface StatusMessageDecoder {
  /**
   * Decodes the status message.
   *
   * @param status status message attached to a variable, may be null
   * @return the message text, or null if there is no status or it carries no format string
   */
  String decode(Snapshot.Status status);
}
