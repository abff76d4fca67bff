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
import com.google.typecheck.types.Type;

/**
 * Recognizes subtyping failures between two instantiations of the same generic that would have
 * succeeded had an invariant parameter been covariant, e.g. {@code list[int]} against {@code
 * list[float]}. Used to explain errors; solving never consults it.
 */
final class InvarianceMismatchDetector {
  private final Resolution resolution;

  InvarianceMismatchDetector(Resolution resolution) {
    this.resolution = resolution;
  }

  boolean isInvarianceMismatch(Type left, Type right) {
    Type.Parametric leftParametric = left.toMaybeParametric();
    Type.Parametric rightParametric = right.toMaybeParametric();
    if (leftParametric == null
        || rightParametric == null
        || !leftParametric.name().equals(rightParametric.name())) {
      return false;
    }
    ImmutableList<Type.Variable> variables = resolution.order().variables(left);
    ImmutableList<Type> leftParameters = leftParametric.parameters();
    ImmutableList<Type> rightParameters = rightParametric.parameters();
    if (variables == null
        || variables.size() != leftParameters.size()
        || variables.size() != rightParameters.size()) {
      return false;
    }
    for (int i = 0; i < variables.size(); i++) {
      if (variables.get(i).variance() == Type.Variance.INVARIANT
          && resolution.lessOrEqual(leftParameters.get(i), rightParameters.get(i))) {
        return true;
      }
    }
    return false;
  }
}
