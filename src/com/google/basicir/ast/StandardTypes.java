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

package com.google.basicir.ast;

/**
 * The predefined types of the source language, as declarations of the AST adapter.
 *
 * <p>The universal types are the types of numeric literals and named numbers before they are
 * resolved against their context. They have no runtime representation.
 */
public interface StandardTypes {

  AstNode getBoolType();

  AstNode getIntType();

  AstNode getUniversalIntType();

  AstNode getUniversalRealType();
}
