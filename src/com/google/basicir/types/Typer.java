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

import org.jspecify.annotations.Nullable;

/**
 * Maps type hints to abstract types. A typer is total: it answers null for the hints it does not
 * handle, so that typers can be chained with {@link #or}.
 *
 * @param <T> the kind of type hint
 */
@FunctionalInterface
public interface Typer<T> {

  /** The abstract type of {@code hint}, or null if this typer does not handle it. */
  @Nullable AbstractType apply(T hint);

  /** A typer which tries this typer first, and {@code other} when this one has no answer. */
  default Typer<T> or(Typer<? super T> other) {
    return hint -> {
      AbstractType type = apply(hint);
      return type != null ? type : other.apply(hint);
    };
  }
}
