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

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * The subtyping lattice over nominal and structural types. Implementations own the class
 * hierarchy, ancestor linearization and the declared variance of generic parameters; the analysis
 * only queries them.
 *
 * <p>Queries that need to look up a nominal type by name throw {@link UntrackedTypeException} when
 * the name is unknown.
 */
public interface TypeOrder {

  /** Whether {@code left} may be used where {@code right} is expected. */
  boolean lessOrEqual(Type left, Type right);

  /** The least upper bound of the two types. */
  Type join(Type left, Type right);

  /** The greatest lower bound of the two types. */
  Type meet(Type left, Type right);

  /**
   * Joins {@code next} into {@code previous} during fixpoint iteration, giving up precision once
   * {@code iteration} exceeds the order's widening threshold.
   */
  Type widen(Type previous, Type next, int iteration);

  /** Whether the order knows the given nominal type. */
  boolean contains(Type type);

  /**
   * Returns the declared type variables of the generic behind {@code type}, in parameter order, or
   * null if {@code type} is not generic or not known.
   */
  @Nullable ImmutableList<Type.Variable> variables(Type type);

  /**
   * Walks the ancestors of {@code source} until it finds the generic class {@code target} and
   * returns the parameters that ancestor is instantiated with, as seen from {@code source}. Returns
   * null if {@code target} is not an ancestor of {@code source}.
   *
   * @throws UntrackedTypeException if {@code source} or {@code target} is not known to the order
   */
  @Nullable ImmutableList<Type> instantiateSuccessorsParameters(Type source, String target);

  /** Whether every nominal type in {@code type} is known and fully instantiated. */
  boolean isInstantiated(Type type);
}
