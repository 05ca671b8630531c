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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.Immutable;

/** The integers from {@link #getLow} to {@link #getHigh}, both included. */
@AutoValue
@Immutable
public abstract class IntRangeType extends AbstractType {
  public abstract long getLow();

  public abstract long getHigh();

  public static IntRangeType create(long low, long high) {
    checkArgument(low <= high, "Empty range %s .. %s", low, high);
    return new AutoValue_IntRangeType(low, high);
  }

  @Override
  public final String toString() {
    return "IntRange(" + getLow() + ", " + getHigh() + ")";
  }
}
