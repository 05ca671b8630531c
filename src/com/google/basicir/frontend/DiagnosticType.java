/*
 * Copyright 2026 The Basic IR Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.basicir.frontend;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.CharMatcher;
import java.io.Serializable;
import java.text.MessageFormat;

/**
 * The kind of problem that keeps a subprogram from being lowered.
 *
 * @param key unique identifier, e.g. {@code BASIC_IR_UNSUPPORTED_CONSTRUCT}
 * @param format a {@link MessageFormat} pattern over the arguments of each report
 * @param level the level reports of this kind get
 */
public record DiagnosticType(String key, String format, CheckLevel level) implements Serializable {
  private static final CharMatcher KEY_CHARS =
      CharMatcher.inRange('A', 'Z').or(CharMatcher.inRange('0', '9')).or(CharMatcher.is('_'));

  public DiagnosticType {
    checkArgument(!key.isEmpty() && KEY_CHARS.matchesAllOf(key), "Malformed key: %s", key);
    checkNotNull(format, "format");
    checkNotNull(level, "level");
  }

  /** A diagnostic reported as an error, whose subprogram yields no IR. */
  public static DiagnosticType error(String key, String format) {
    return new DiagnosticType(key, format, CheckLevel.ERROR);
  }

  String formatMessage(String... arguments) {
    return MessageFormat.format(format, (Object[]) arguments);
  }

  @Override
  public String toString() {
    return key + ": " + format;
  }
}
