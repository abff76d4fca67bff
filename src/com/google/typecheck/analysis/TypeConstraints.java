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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.typecheck.types.Type;
import org.jspecify.annotations.Nullable;

/**
 * A substitution from type variables to the types inferred for them during a single solve. Each
 * variable has at most one binding. Values are immutable: {@link #with} returns a new
 * substitution, so a partial solve along a rejected alternative leaves no trace.
 */
@AutoValue
@CheckReturnValue
public abstract class TypeConstraints {
  private static final TypeConstraints EMPTY =
      new AutoValue_TypeConstraints(ImmutableMap.of());

  public abstract ImmutableMap<Type.Variable, Type> asMap();

  public static TypeConstraints empty() {
    return EMPTY;
  }

  public static TypeConstraints of(Type.Variable variable, Type solution) {
    return new AutoValue_TypeConstraints(ImmutableMap.of(variable, solution));
  }

  public final boolean isEmpty() {
    return asMap().isEmpty();
  }

  /** Returns the type currently inferred for {@code variable}, or null if it is unbound. */
  public final @Nullable Type get(Type.Variable variable) {
    return asMap().get(variable);
  }

  /** Returns a substitution in which {@code variable} is bound to {@code solution}. */
  public final TypeConstraints with(Type.Variable variable, Type solution) {
    if (solution.equals(asMap().get(variable))) {
      return this;
    }
    return new AutoValue_TypeConstraints(
        ImmutableMap.<Type.Variable, Type>builder()
            .putAll(asMap())
            .put(variable, solution)
            .buildKeepingLast());
  }

  /** Replaces every bound variable in {@code type} by its solution. */
  public final Type instantiate(Type type) {
    if (isEmpty()) {
      return type;
    }
    return type.instantiate(t -> t.isVariable() ? asMap().get(t.toMaybeVariable()) : null);
  }

  @Override
  public final String toString() {
    return asMap().toString();
  }
}
