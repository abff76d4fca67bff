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
import com.google.typecheck.ast.ClassDefinition;
import com.google.typecheck.types.Type;
import com.google.typecheck.types.Type.Callable.Signature;
import com.google.typecheck.types.UntrackedTypeException;
import com.google.typecheck.types.VariableConstraints;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Decides whether a source type may be used where a target type is expected, inferring bindings
 * for the free type variables of the target on the way.
 *
 * <p>Every step returns either an extended substitution or null. Substitutions are immutable, so
 * an alternative that fails halfway does not leak bindings into the next one.
 */
final class ConstraintSolver {
  private static final Logger logger = Logger.getLogger(ConstraintSolver.class.getName());

  private final Resolution resolution;

  ConstraintSolver(Resolution resolution) {
    this.resolution = resolution;
  }

  @Nullable TypeConstraints solve(TypeConstraints constraints, Type source, Type target) {
    try {
      return solveThrows(constraints, source, target);
    } catch (UntrackedTypeException e) {
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("No solution for " + source + " <= " + target + ": " + e.getMessage());
      }
      return null;
    }
  }

  private @Nullable TypeConstraints solveThrows(
      TypeConstraints constraints, Type source, Type target) {
    source = instantiateConstructor(source, target);

    switch (source.kind()) {
      case BOTTOM:
        // Locals unbound on some path are compatible with anything.
        return constraints;
      case UNION:
        TypeConstraints solved = constraints;
        for (Type member : source.toMaybeUnion().members()) {
          solved = solveThrows(solved, member, target);
          if (solved == null) {
            return null;
          }
        }
        return solved;
      default:
        break;
    }

    if (target.isResolved()) {
      if (source.isTop() && target.isObject()) {
        return constraints;
      }
      return resolution.lessOrEqual(source, target) ? constraints : null;
    }

    switch (target.kind()) {
      case VARIABLE:
        return solveVariable(constraints, source, target.toMaybeVariable());
      case PARAMETRIC:
        return solveParametric(constraints, source, target.toMaybeParametric());
      case OPTIONAL:
        Type unwrapped = source.isOptional() ? source.toMaybeOptional().inner() : source;
        return solveThrows(constraints, unwrapped, target.toMaybeOptional().inner());
      case TUPLE:
        return source.isTuple()
            ? solveTuples(constraints, source.toMaybeTuple(), target.toMaybeTuple())
            : null;
      case UNION:
        // Only the first alternative that works is kept. Considering all of them would need a
        // fixpoint over the alternatives.
        for (Type member : target.toMaybeUnion().members()) {
          TypeConstraints alternative = solveThrows(constraints, source, member);
          if (alternative != null) {
            return alternative;
          }
        }
        return null;
      case CALLABLE:
        return source.isCallable()
            ? solveCallables(
                constraints,
                source.toMaybeCallable().implementation(),
                target.toMaybeCallable().implementation())
            : null;
      case META:
        return source.isMeta()
            ? solveThrows(
                constraints, source.toMaybeMeta().instance(), target.toMaybeMeta().instance())
            : null;
      case TOP:
      case BOTTOM:
      case OBJECT:
      case DELETED:
      case PRIMITIVE:
        // Resolved targets were handled above.
        return null;
    }
    throw new IllegalStateException("Unexpected target " + target);
  }

  /**
   * Asking whether a class object fits a callable is asking whether calling the class produces
   * something that fits, so the class object is replaced by its constructor's type.
   */
  private Type instantiateConstructor(Type source, Type target) {
    if (!source.isMeta() || !target.isCallable()) {
      return source;
    }
    Type instantiated = source.singleParameter();
    ClassDefinition definition = resolution.classDefinition(instantiated);
    return definition != null ? resolution.constructor(instantiated, definition) : source;
  }

  private @Nullable TypeConstraints solveAll(
      TypeConstraints constraints,
      List<Type> sources,
      List<Type> targets,
      boolean ignoreLengthMismatch) {
    if (sources.size() != targets.size() && !ignoreLengthMismatch) {
      return null;
    }
    int shared = Math.min(sources.size(), targets.size());
    TypeConstraints solved = constraints;
    for (int i = 0; i < shared && solved != null; i++) {
      solved = solveThrows(solved, sources.get(i), targets.get(i));
    }
    return solved;
  }

  private @Nullable TypeConstraints solveVariable(
      TypeConstraints constraints, Type source, Type.Variable variable) {
    Type existing = constraints.get(variable);
    Type joined = existing != null ? trueJoin(existing, source) : source;
    Type accepted = acceptBinding(joined, variable.constraints());
    return accepted != null ? constraints.with(variable, accepted) : null;
  }

  /**
   * Joins two solutions for the same variable. The order's join can jump to a common ancestor that
   * is more permissive than the union of the two; the union is used instead in that case.
   */
  private Type trueJoin(Type left, Type right) {
    Type joined = resolution.join(left, right);
    Type unionized = Type.union(left, right);
    return resolution.lessOrEqual(joined, unionized) ? joined : unionized;
  }

  /** Returns what the variable is bound to if {@code joined} satisfies its constraints. */
  private @Nullable Type acceptBinding(Type joined, VariableConstraints constraints) {
    switch (constraints.kind()) {
      case UNCONSTRAINED:
        return joined;
      case BOUND:
        return resolution.lessOrEqual(joined, constraints.toMaybeBound().bound()) ? joined : null;
      case EXPLICIT:
        ImmutableList<Type> alternatives = constraints.toMaybeExplicit().alternatives();
        Type.Variable joinedVariable = joined.toMaybeVariable();
        if (joinedVariable != null) {
          VariableConstraints joinedConstraints = joinedVariable.constraints();
          if (joinedConstraints.isExplicit()) {
            return alternatives.containsAll(joinedConstraints.toMaybeExplicit().alternatives())
                ? joined
                : null;
          }
          if (joinedConstraints.isBound()) {
            return firstSupertype(joinedConstraints.toMaybeBound().bound(), alternatives);
          }
        }
        return firstSupertype(joined, alternatives);
    }
    throw new IllegalStateException("Unexpected constraints " + constraints);
  }

  private @Nullable Type firstSupertype(Type type, List<Type> candidates) {
    for (Type candidate : candidates) {
      if (resolution.lessOrEqual(type, candidate)) {
        return candidate;
      }
    }
    return null;
  }

  private @Nullable TypeConstraints solveParametric(
      TypeConstraints constraints, Type source, Type.Parametric target) {
    ImmutableList<Type> parameters =
        resolution.order().instantiateSuccessorsParameters(source, target.name());
    if (parameters == null) {
      return null;
    }
    TypeConstraints solved = solveAll(constraints, parameters, target.parameters(), false);
    if (solved == null) {
      return null;
    }
    // Solving the parameters one by one ignores how they interact under variance.
    return resolution.lessOrEqual(source, solved.instantiate(target)) ? solved : null;
  }

  private @Nullable TypeConstraints solveTuples(
      TypeConstraints constraints, Type.Tuple source, Type.Tuple target) {
    if (source.isBounded() && target.isBounded()) {
      return solveAll(constraints, source.elements(), target.elements(), false);
    }
    if (!source.isBounded() && !target.isBounded()) {
      return solveThrows(constraints, source.element(), target.element());
    }
    if (!source.isBounded()) {
      List<Type> sources = Collections.nCopies(target.elements().size(), source.element());
      return solveAll(constraints, sources, target.elements(), false);
    }
    return solveThrows(constraints, Type.union(source.elements()), target.element());
  }

  private @Nullable TypeConstraints solveCallables(
      TypeConstraints constraints, Signature source, Signature target) {
    TypeConstraints solved = solveThrows(constraints, source.annotation(), target.annotation());
    if (solved == null) {
      return null;
    }
    // Parameter lists may differ in length because of defaults, *args or **kwargs; only the
    // positions both sides have are compared.
    return solveAll(
        solved, source.parameterAnnotations(), target.parameterAnnotations(), true);
  }
}
