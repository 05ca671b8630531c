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
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An error manager that logs errors and warnings using a logger in addition to collecting them in
 * memory. Errors are logged at the SEVERE level and warnings are logged at the WARNING level.
 */
public class LoggerErrorManager implements ErrorManager {
  private final Logger logger;
  private final ImmutableList.Builder<ExtractionError> errors = ImmutableList.builder();
  private final ImmutableList.Builder<ExtractionError> warnings = ImmutableList.builder();
  private int errorCount = 0;
  private int warningCount = 0;

  public LoggerErrorManager(Logger logger) {
    this.logger = logger;
  }

  /** Creates an instance logging to the logger of the frontend package. */
  public LoggerErrorManager() {
    this(Logger.getLogger(LoggerErrorManager.class.getPackage().getName()));
  }

  @Override
  public void report(CheckLevel level, ExtractionError error) {
    switch (level) {
      case ERROR:
        errors.add(error);
        errorCount++;
        logger.severe(error.format());
        break;
      case WARNING:
        warnings.add(error);
        warningCount++;
        logger.warning(error.format());
        break;
      case OFF:
        break;
    }
  }

  @Override
  public void generateReport() {
    Level level = (getErrorCount() + getWarningCount() == 0) ? Level.INFO : Level.WARNING;
    logger.log(
        level,
        "{0} error(s), {1} warning(s)",
        new Object[] {getErrorCount(), getWarningCount()});
  }

  @Override
  public int getErrorCount() {
    return errorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public ImmutableList<ExtractionError> getErrors() {
    return errors.build();
  }

  @Override
  public ImmutableList<ExtractionError> getWarnings() {
    return warnings.build();
  }
}
