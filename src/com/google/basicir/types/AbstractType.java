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

import com.google.errorprone.annotations.Immutable;

/**
 * A type of the abstract interpretation domain, as opposed to the source type a Basic IR node is
 * annotated with. Abstract types are values: two instances describing the same type are equal.
 */
@Immutable
public abstract class AbstractType {
  AbstractType() {}
}
