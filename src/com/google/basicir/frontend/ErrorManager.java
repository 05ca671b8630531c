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

import com.google.common.collect.ImmutableList;

/** Receives the errors reported while extracting programs. */
public interface ErrorManager {

  /** Reports an error at the given level. Errors reported at {@link CheckLevel#OFF} are dropped. */
  void report(CheckLevel level, ExtractionError error);

  /** Writes a summary of everything reported so far. */
  void generateReport();

  int getErrorCount();

  int getWarningCount();

  ImmutableList<ExtractionError> getErrors();

  ImmutableList<ExtractionError> getWarnings();
}
