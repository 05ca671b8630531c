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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/** Static factories for {@link Typer}s. */
public final class Typers {

  private Typers() {}

  /**
   * Builds a typer which may refer to itself. {@code definition} receives a typer forwarding to
   * the typer {@code definition} returns, so that e.g. a typer for pointers can be given the
   * complete typer for their element types. The forwarding typer must not be applied before
   * {@code definition} returns.
   */
  public static <T> Typer<T> delegating(Function<? super Typer<T>, ? extends Typer<T>> definition) {
    DelegatingTyper<T> typer = new DelegatingTyper<>();
    typer.delegate = checkNotNull(definition.apply(typer));
    return typer;
  }

  /** A typer which handles no hint. */
  public static <T> Typer<T> none() {
    return hint -> null;
  }

  private static final class DelegatingTyper<T> implements Typer<T> {
    private @Nullable Typer<T> delegate;

    @Override
    public @Nullable AbstractType apply(T hint) {
      checkState(delegate != null, "Typer applied during its own definition");
      return delegate.apply(hint);
    }
  }
}
