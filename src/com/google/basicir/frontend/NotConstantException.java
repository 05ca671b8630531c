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

/**
 * Thrown by {@link ConstExprEvaluator} when an expression has no static value. This is an ordinary
 * outcome for most expressions; only callers which rely on the source language guaranteeing a
 * static value treat it as an error.
 */
public final class NotConstantException extends Exception {
  NotConstantException(String message) {
    super(message);
  }
}
