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

package com.google.basicir.types;

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.Immutable;

/** The two-valued boolean type. */
@AutoValue
@Immutable
public abstract class BooleanType extends AbstractType {
  public static BooleanType create() {
    return new AutoValue_BooleanType();
  }

  @Override
  public final String toString() {
    return "Boolean";
  }
}
