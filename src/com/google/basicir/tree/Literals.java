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

package com.google.basicir.tree;

/**
 * Literal values carried by {@link Lit} nodes.
 *
 * <p>Integers are {@code Long}s. Boolean and enumeration literals are represented by their source
 * text, so {@code True} is the string {@link #TRUE}. The null access value is {@link #NULL}.
 */
public final class Literals {
  public static final String TRUE = "True";
  public static final String FALSE = "False";

  /** The value of the {@code null} literal. */
  public static final Object NULL =
      new Object() {
        @Override
        public String toString() {
          return "null";
        }
      };

  private Literals() {}

  public static String fromBoolean(boolean value) {
    return value ? TRUE : FALSE;
  }

  public static boolean toBoolean(Object value) {
    return TRUE.equals(value);
  }

  public static boolean isBoolean(Object value) {
    return TRUE.equals(value) || FALSE.equals(value);
  }
}
