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

/** A pointer to values of {@link #getElementType}, or null. */
@AutoValue
@Immutable
public abstract class PointerType extends AbstractType {
  public abstract AbstractType getElementType();

  public static PointerType create(AbstractType elementType) {
    return new AutoValue_PointerType(elementType);
  }

  @Override
  public final String toString() {
    return "Pointer(" + getElementType() + ")";
  }
}
