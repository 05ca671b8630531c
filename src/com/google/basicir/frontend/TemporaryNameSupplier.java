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

import com.google.common.base.Ascii;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multiset;

/**
 * Generates names for the variables and labels the frontend introduces.
 *
 * <p>A generated name is a base name followed by a counter local to that base name, e.g. {@code
 * tmp0}, {@code tmp1}, {@code exit_loop0}. Names the source already declares, compared without
 * regard to case, are skipped.
 */
final class TemporaryNameSupplier {
  private final Multiset<String> counter = HashMultiset.create();
  private final ImmutableSet<String> reserved;

  /** @param reserved lower-case names which must never be generated */
  TemporaryNameSupplier(ImmutableSet<String> reserved) {
    this.reserved = reserved;
  }

  /** Creates and returns a name that was never returned before and is not reserved. */
  String get(String base) {
    String name;
    do {
      int id = counter.add(base, 1);
      name = base + id;
    } while (reserved.contains(Ascii.toLowerCase(name)));
    return name;
  }
}
