/*
 * Copyright 2018 The Closure Compiler Authors.
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

package com.google.typecheck.analysis;

import com.google.common.collect.ImmutableList;
import com.google.typecheck.ast.Expression;
import com.google.typecheck.types.Type;
import org.jspecify.annotations.Nullable;

/**
 * Containers are invariant, so {@code [1, 2]} resolved as {@code list[int]} would not fit an
 * expected {@code list[float]}. A literal has no other aliases, though, so at the point where it
 * is written it may take the expected container type as long as its elements fit.
 */
final class MutableLiteralResolver {
  private final Resolution resolution;

  MutableLiteralResolver(Resolution resolution) {
    this.resolution = resolution;
  }

  Type resolve(@Nullable Expression expression, Type resolved, Type expected) {
    if (expression == null) {
      return resolved;
    }
    switch (expression.kind()) {
      case LIST:
      case LIST_COMPREHENSION:
        return reconcile(Type.LIST_NAME, 1, resolved, expected);
      case SET:
      case SET_COMPREHENSION:
        return reconcile(Type.SET_NAME, 1, resolved, expected);
      case DICTIONARY:
      case DICTIONARY_COMPREHENSION:
        return reconcile(Type.DICTIONARY_NAME, 2, resolved, expected);
      default:
        return resolved;
    }
  }

  private Type reconcile(String container, int arity, Type resolved, Type expected) {
    Type.Parametric actual = resolved.toMaybeParametric();
    Type.Parametric wanted = expected.toMaybeParametric();
    if (actual == null
        || wanted == null
        || !actual.name().equals(container)
        || !wanted.name().equals(container)) {
      return resolved;
    }
    ImmutableList<Type> actualParameters = actual.parameters();
    ImmutableList<Type> wantedParameters = wanted.parameters();
    if (actualParameters.size() != arity || wantedParameters.size() != arity) {
      return resolved;
    }
    for (int i = 0; i < arity; i++) {
      if (!resolution.lessOrEqual(actualParameters.get(i), wantedParameters.get(i))) {
        return resolved;
      }
    }
    return expected;
  }
}
