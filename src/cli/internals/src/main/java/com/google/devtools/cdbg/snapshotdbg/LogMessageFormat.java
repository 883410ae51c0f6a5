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

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Logpoint message in the form consumed by the debug agents.
 *
 * <p>The user writes a log message such as {@code "a={a}, b={b}"}, where the text inside curly
 * braces is an expression evaluated when the logpoint is hit. The agents instead expect a format
 * string where each expression is replaced by {@code $N}, N being the index of the expression in a
 * separate list, and where a literal {@code $} is escaped as {@code $$}:
 *
 * <pre>
 *   user message                 log message format      expressions
 *   "Hello there"                "Hello there"           []
 *   "x = {x}, y = {y}"           "x = $0, y = $1"        ["x", "y"]
 *   "x = {x{1}}, x = {x{1}}"     "x = $0, x = $0"        ["x{1}"]
 *   "cost: $ {price}"            "cost: $$ $0"           ["price"]
 * </pre>
 */
public final class LogMessageFormat {
  /** A $ followed by the index of an expression. */
  private static final Pattern EXPRESSION_REFERENCE = Pattern.compile("\\$(\\d+)");

  private final String format;
  private final ImmutableList<String> expressions;

  public LogMessageFormat(String format, List<String> expressions) {
    this.format = Objects.requireNonNull(format);
    this.expressions = ImmutableList.copyOf(expressions);
  }

  /** Gets the format string, with expressions replaced by $N. */
  public String getFormat() {
    return format;
  }

  /** Gets the distinct expressions, in order of first use in the user message. */
  public ImmutableList<String> getExpressions() {
    return expressions;
  }

  /** Converts back to the user message form. */
  public String toUserMessage() {
    return merge(format, expressions);
  }

  /**
   * Extracts the {expression} substrings of a user log message.
   *
   * <p>Each {expression} is replaced with $N, N being the index of the expression in the returned
   * expressions list. Identical expressions share the same index. Braces may nest inside an
   * expression, only the outermost pair delimits it. A '$' outside of any expression is escaped as
   * '$$'. When an expression is immediately followed by a digit a space is inserted after $N, so
   * that the agent doesn't read the digit as part of the index.
   *
   * @param userMessage the log message as entered by the user
   * @return the log message format and its expressions
   * @throws LogMessageFormatException if the braces are unbalanced
   */
  public static LogMessageFormat split(String userMessage) throws LogMessageFormatException {
    List<String> expressions = new ArrayList<>();
    StringBuilder format = new StringBuilder();
    StringBuilder expression = new StringBuilder();
    int braceCount = 0;

    for (int i = 0; i < userMessage.length(); i++) {
      char c = userMessage.charAt(i);

      if (braceCount == 0) {
        if (c == '{') {
          expression.setLength(0);
          braceCount = 1;
        } else if (c == '}') {
          throw new LogMessageFormatException(Messages.TOO_MANY_CLOSING_BRACES);
        } else if (c == '$') {
          format.append("$$");
        } else {
          format.append(c);
        }
        continue;
      }

      if (c == '{') {
        braceCount++;
        expression.append(c);
      } else if (c != '}') {
        expression.append(c);
      } else if (--braceCount > 0) {
        // Closing a nested brace.
        expression.append(c);
      } else {
        String text = expression.toString();
        int index = expressions.indexOf(text);
        if (index == -1) {
          index = expressions.size();
          expressions.add(text);
        }

        format.append('$').append(index);
        if (i + 1 < userMessage.length() && isAsciiDigit(userMessage.charAt(i + 1))) {
          format.append(' ');
        }
      }
    }

    if (braceCount != 0) {
      throw new LogMessageFormatException(Messages.TOO_MANY_OPENING_BRACES);
    }

    return new LogMessageFormat(format.toString(), expressions);
  }

  /**
   * Converts a log message format and its expressions back into the user message form.
   *
   * <p>The input is expected to come from existing logpoints. A $N referring to a missing
   * expression is kept as is.
   *
   * @param format log message format with $N references and $$ escapes
   * @param expressions expressions the $N references index into
   * @return the log message with {expression} substrings
   */
  public static String merge(String format, List<String> expressions) {
    List<String> segments = new ArrayList<>();
    for (String segment : Splitter.on("$$").split(format)) {
      segments.add(substituteExpressions(segment, expressions));
    }

    return Joiner.on('$').join(segments);
  }

  private static String substituteExpressions(String segment, List<String> expressions) {
    Matcher matcher = EXPRESSION_REFERENCE.matcher(segment);
    StringBuffer result = new StringBuffer();
    while (matcher.find()) {
      String replacement = matcher.group();
      Integer index = parseIndex(matcher.group(1));
      if (index != null && index < expressions.size()) {
        replacement = "{" + expressions.get(index) + "}";
      }
      matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(result);
    return result.toString();
  }

  /** Returns null if the digits don't fit in an int. */
  private static Integer parseIndex(String digits) {
    try {
      return Integer.parseInt(digits);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static boolean isAsciiDigit(char c) {
    return c >= '0' && c <= '9';
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof LogMessageFormat)) {
      return false;
    }
    LogMessageFormat that = (LogMessageFormat) other;
    return format.equals(that.format) && expressions.equals(that.expressions);
  }

  @Override
  public int hashCode() {
    return Objects.hash(format, expressions);
  }

  @Override
  public String toString() {
    return "LogMessageFormat{format=" + format + ", expressions=" + expressions + "}";
  }
}
