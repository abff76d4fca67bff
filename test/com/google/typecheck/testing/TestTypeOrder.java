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

package com.google.typecheck.testing;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.typecheck.types.Type;
import com.google.typecheck.types.Type.Variance;
import com.google.typecheck.types.TypeOrder;
import com.google.typecheck.types.UntrackedTypeException;
import com.google.typecheck.types.VariableConstraints;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A small single-inheritance type order for tests. Classes are registered by name with an
 * optional superclass, expressed in terms of the class's own type variables. Classes without a
 * superclass sit directly below {@code object}.
 *
 * <p>The default order knows {@code bool <= int <= float <= complex}, {@code str}, {@code bytes},
 * the covariant generics {@code typing.Iterable}, {@code typing.Awaitable} and {@code Yield}, the
 * invariant containers {@code list}, {@code set} and {@code dict} (all iterable), an invariant
 * {@code Box} and {@code IntList <= list[int]}.
 */
public final class TestTypeOrder implements TypeOrder {
  private static final int WIDENING_THRESHOLD = 10;

  private final Map<String, ImmutableList<Type.Variable>> classes = new HashMap<>();
  private final Map<String, Type> superclasses = new HashMap<>();

  private TestTypeOrder() {}

  public static TestTypeOrder create() {
    TestTypeOrder order = new TestTypeOrder();
    Type.Variable covariant =
        Type.variable("_T_co", VariableConstraints.UNCONSTRAINED, Variance.COVARIANT);
    Type.Variable element = Type.variable("_T");
    Type.Variable key = Type.variable("_K");
    Type.Variable value = Type.variable("_V");
    order
        .addClass("complex", null)
        .addClass("float", Type.COMPLEX)
        .addClass("int", Type.FLOAT)
        .addClass("bool", Type.INTEGER)
        .addClass("str", null)
        .addClass("bytes", null)
        .addClass("typing.Iterable", null, covariant)
        .addClass("typing.Awaitable", null, covariant)
        .addClass("Yield", null, covariant)
        .addClass("list", iterable(element), element)
        .addClass("set", iterable(element), element)
        .addClass("dict", iterable(key), key, value)
        .addClass("Box", null, element)
        .addClass("IntList", Type.list(Type.INTEGER));
    return order;
  }

  public static Type iterable(Type element) {
    return Type.parametric("typing.Iterable", element);
  }

  /** Registers a class. {@code superclass} may mention {@code variables}. */
  public TestTypeOrder addClass(
      String name, @Nullable Type superclass, Type.Variable... variables) {
    checkArgument(!classes.containsKey(name), "Duplicate class %s", name);
    classes.put(name, ImmutableList.copyOf(variables));
    if (superclass != null) {
      superclasses.put(name, superclass);
    }
    return this;
  }

  @Override
  public boolean lessOrEqual(Type left, Type right) {
    if (left.equals(right) || left.isBottom() || right.isTop()) {
      return true;
    }
    if (left.isTop()) {
      return false;
    }
    if (left.isUnion()) {
      for (Type member : left.toMaybeUnion().members()) {
        if (!lessOrEqual(member, right)) {
          return false;
        }
      }
      return true;
    }
    if (right.isUnion()) {
      for (Type member : right.toMaybeUnion().members()) {
        if (lessOrEqual(left, member)) {
          return true;
        }
      }
      return false;
    }
    if (right.isObject()) {
      return true;
    }
    if (left.isOptional()) {
      return right.isOptional()
          && lessOrEqual(left.toMaybeOptional().inner(), right.toMaybeOptional().inner());
    }
    if (right.isOptional()) {
      return lessOrEqual(left, right.toMaybeOptional().inner());
    }
    if (left.isVariable()) {
      VariableConstraints constraints = left.toMaybeVariable().constraints();
      if (constraints.isBound()) {
        return lessOrEqual(constraints.toMaybeBound().bound(), right);
      }
      if (constraints.isExplicit()) {
        return lessOrEqual(Type.union(constraints.toMaybeExplicit().alternatives()), right);
      }
      return false;
    }
    if (left.isTuple() && right.isTuple()) {
      return tupleLessOrEqual(left.toMaybeTuple(), right.toMaybeTuple());
    }
    if (left.isCallable() && right.isCallable()) {
      return callableLessOrEqual(left.toMaybeCallable(), right.toMaybeCallable());
    }
    if (left.isMeta()) {
      return right.isMeta()
          && lessOrEqual(left.toMaybeMeta().instance(), right.toMaybeMeta().instance());
    }
    if (isNominal(left) && isNominal(right)) {
      return nominalLessOrEqual(left, right);
    }
    return false;
  }

  private boolean tupleLessOrEqual(Type.Tuple left, Type.Tuple right) {
    if (left.isBounded() && right.isBounded()) {
      if (left.elements().size() != right.elements().size()) {
        return false;
      }
      for (int i = 0; i < left.elements().size(); i++) {
        if (!lessOrEqual(left.elements().get(i), right.elements().get(i))) {
          return false;
        }
      }
      return true;
    }
    if (left.isBounded()) {
      return lessOrEqual(Type.union(left.elements()), right.element());
    }
    return !right.isBounded() && lessOrEqual(left.element(), right.element());
  }

  private boolean callableLessOrEqual(Type.Callable left, Type.Callable right) {
    Type.Callable.Signature leftSignature = left.implementation();
    Type.Callable.Signature rightSignature = right.implementation();
    if (!lessOrEqual(leftSignature.annotation(), rightSignature.annotation())) {
      return false;
    }
    if (leftSignature.parameters() == null || rightSignature.parameters() == null) {
      return true;
    }
    List<Type> leftParameters = leftSignature.parameterAnnotations();
    List<Type> rightParameters = rightSignature.parameterAnnotations();
    if (leftParameters.size() != rightParameters.size()) {
      return false;
    }
    for (int i = 0; i < leftParameters.size(); i++) {
      if (!lessOrEqual(rightParameters.get(i), leftParameters.get(i))) {
        return false;
      }
    }
    return true;
  }

  private boolean nominalLessOrEqual(Type left, Type right) {
    String rightName = nameOf(right);
    if (!classes.containsKey(nameOf(left)) || !classes.containsKey(rightName)) {
      return false;
    }
    ImmutableList<Type> parameters = instantiateSuccessorsParameters(left, rightName);
    if (parameters == null) {
      return false;
    }
    if (right.isPrimitive()) {
      return true;
    }
    ImmutableList<Type> rightParameters = right.toMaybeParametric().parameters();
    ImmutableList<Type.Variable> variables = classes.get(rightName);
    if (parameters.size() != rightParameters.size() || variables.size() != parameters.size()) {
      return false;
    }
    for (int i = 0; i < parameters.size(); i++) {
      Type actual = parameters.get(i);
      Type expected = rightParameters.get(i);
      switch (variables.get(i).variance()) {
        case COVARIANT:
          if (!lessOrEqual(actual, expected)) {
            return false;
          }
          break;
        case CONTRAVARIANT:
          if (!lessOrEqual(expected, actual)) {
            return false;
          }
          break;
        case INVARIANT:
          if (!lessOrEqual(actual, expected) || !lessOrEqual(expected, actual)) {
            return false;
          }
          break;
      }
    }
    return true;
  }

  @Override
  public Type join(Type left, Type right) {
    if (lessOrEqual(left, right)) {
      return right;
    }
    if (lessOrEqual(right, left)) {
      return left;
    }
    if (isNominal(left) && isNominal(right) && classes.containsKey(nameOf(left))) {
      for (Type ancestor : ancestors(left)) {
        if (lessOrEqual(right, ancestor)) {
          return ancestor;
        }
      }
      return Type.OBJECT;
    }
    return Type.union(left, right);
  }

  @Override
  public Type meet(Type left, Type right) {
    if (lessOrEqual(left, right)) {
      return left;
    }
    if (lessOrEqual(right, left)) {
      return right;
    }
    return Type.BOTTOM;
  }

  @Override
  public Type widen(Type previous, Type next, int iteration) {
    return iteration > WIDENING_THRESHOLD ? Type.TOP : join(previous, next);
  }

  @Override
  public boolean contains(Type type) {
    return !isNominal(type) || classes.containsKey(nameOf(type));
  }

  @Override
  public @Nullable ImmutableList<Type.Variable> variables(Type type) {
    if (!isNominal(type)) {
      return null;
    }
    ImmutableList<Type.Variable> variables = classes.get(nameOf(type));
    return variables == null || variables.isEmpty() ? null : variables;
  }

  @Override
  public @Nullable ImmutableList<Type> instantiateSuccessorsParameters(Type source, String target) {
    if (!isNominal(source)) {
      return null;
    }
    if (!classes.containsKey(nameOf(source))) {
      throw new UntrackedTypeException(source);
    }
    if (!classes.containsKey(target)) {
      throw new UntrackedTypeException(Type.primitive(target));
    }
    Type current = source;
    while (current != null) {
      String name = nameOf(current);
      if (name.equals(target)) {
        return parametersOf(current);
      }
      current = superclassOf(current);
    }
    return null;
  }

  @Override
  public boolean isInstantiated(Type type) {
    for (Type element : type.nominalElements()) {
      if (!contains(element)) {
        return false;
      }
    }
    return type.isResolved();
  }

  /** Returns the proper ancestors of a nominal type, nearest first. */
  private List<Type> ancestors(Type type) {
    List<Type> ancestors = new ArrayList<>();
    Type current = superclassOf(type);
    while (current != null) {
      ancestors.add(current);
      current = superclassOf(current);
    }
    return ancestors;
  }

  /** Returns the instantiated superclass of a nominal type, or null below {@code object}. */
  private @Nullable Type superclassOf(Type type) {
    String name = nameOf(type);
    Type superclass = superclasses.get(name);
    if (superclass == null) {
      return null;
    }
    ImmutableList<Type.Variable> variables = classes.get(name);
    ImmutableList<Type> parameters = parametersOf(type);
    Map<Type, Type> substitution = new HashMap<>();
    for (int i = 0; i < variables.size() && i < parameters.size(); i++) {
      substitution.put(variables.get(i), parameters.get(i));
    }
    return superclass.instantiate(substitution::get);
  }

  /** Parameters of a nominal type; a bare generic is instantiated with unknowns. */
  private ImmutableList<Type> parametersOf(Type type) {
    if (type.isParametric()) {
      return type.toMaybeParametric().parameters();
    }
    ImmutableList.Builder<Type> unknowns = ImmutableList.builder();
    for (int i = 0; i < classes.get(nameOf(type)).size(); i++) {
      unknowns.add(Type.TOP);
    }
    return unknowns.build();
  }

  private static boolean isNominal(Type type) {
    return type.isPrimitive() || type.isParametric();
  }

  private static String nameOf(Type type) {
    return type.isPrimitive() ? type.toMaybePrimitive().name() : type.toMaybeParametric().name();
  }
}
