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

package com.google.typecheck.types;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * What a type variable may be bound to: anything, any subtype of a single bound, or exactly one
 * of an explicit list of alternatives.
 */
public abstract class VariableConstraints {

  /** The shape of the constraint. */
  public enum Kind {
    UNCONSTRAINED,
    BOUND,
    EXPLICIT
  }

  public static final VariableConstraints UNCONSTRAINED = new Unconstrained();

  private VariableConstraints() {}

  public abstract Kind kind();

  public static VariableConstraints bound(Type bound) {
    return new AutoValue_VariableConstraints_Bound(bound);
  }

  public static VariableConstraints explicit(List<Type> alternatives) {
    checkArgument(!alternatives.isEmpty(), "Explicit constraints need at least one alternative");
    return new AutoValue_VariableConstraints_Explicit(ImmutableList.copyOf(alternatives));
  }

  public static VariableConstraints explicit(Type... alternatives) {
    return explicit(ImmutableList.copyOf(alternatives));
  }

  public final boolean isUnconstrained() {
    return kind() == Kind.UNCONSTRAINED;
  }

  public final boolean isBound() {
    return kind() == Kind.BOUND;
  }

  public final boolean isExplicit() {
    return kind() == Kind.EXPLICIT;
  }

  /** Returns this as a bound constraint, or null if it is not one. */
  public @Nullable Bound toMaybeBound() {
    return null;
  }

  /** Returns this as an explicit constraint, or null if it is not one. */
  public @Nullable Explicit toMaybeExplicit() {
    return null;
  }

  private static final class Unconstrained extends VariableConstraints {
    @Override
    public Kind kind() {
      return Kind.UNCONSTRAINED;
    }

    @Override
    public String toString() {
      return "";
    }
  }

  /** An upper bound: the variable may be bound to any subtype of it. */
  @AutoValue
  public abstract static class Bound extends VariableConstraints {
    public abstract Type bound();

    @Override
    public Kind kind() {
      return Kind.BOUND;
    }

    @Override
    public Bound toMaybeBound() {
      return this;
    }

    @Override
    public final String toString() {
      return "bound=" + bound();
    }
  }

  /** The variable must resolve to exactly one of these alternatives. */
  @AutoValue
  public abstract static class Explicit extends VariableConstraints {
    public abstract ImmutableList<Type> alternatives();

    @Override
    public Kind kind() {
      return Kind.EXPLICIT;
    }

    @Override
    public Explicit toMaybeExplicit() {
      return this;
    }

    @Override
    public final String toString() {
      return alternatives().toString();
    }
  }
}
