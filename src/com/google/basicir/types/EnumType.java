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
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;

/** An enumeration type, given by its literals in declaration order. */
@AutoValue
@Immutable
public abstract class EnumType extends AbstractType {
  public abstract ImmutableList<String> getLiterals();

  public static EnumType create(Iterable<String> literals) {
    ImmutableList<String> copy = ImmutableList.copyOf(literals);
    checkArgument(!copy.isEmpty(), "An enumeration needs at least one literal");
    return new AutoValue_EnumType(copy);
  }

  @Override
  public final String toString() {
    return "Enum(" + Joiner.on(", ").join(getLiterals()) + ")";
  }
}
