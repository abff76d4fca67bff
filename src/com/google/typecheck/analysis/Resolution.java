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
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.typecheck.ast.Access;
import com.google.typecheck.ast.ClassDefinition;
import com.google.typecheck.ast.Expression;
import com.google.typecheck.ast.FunctionDefinition;
import com.google.typecheck.ast.ModuleDefinition;
import com.google.typecheck.types.Annotation;
import com.google.typecheck.types.Type;
import com.google.typecheck.types.TypeOrder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The type environment of one analysis unit: the annotations of its locals, the type order, and
 * the lookups into the global, module and class tables.
 *
 * <p>A resolution is an immutable value. Updating a local produces a new resolution, so the
 * control-flow driver can fork one per branch and compare or merge the forks later. The injected
 * capabilities are shared by every fork and must not change while a unit is analyzed.
 */
@AutoValue
@CheckReturnValue
public abstract class Resolution {

  /** Computes the type of an arbitrary expression in the given environment. */
  @FunctionalInterface
  public interface ExpressionResolver {
    Type resolve(Resolution resolution, Expression expression);
  }

  /** Turns annotation syntax into a type, before any tracking policy is applied. */
  @FunctionalInterface
  public interface RawAnnotationParser {
    Type parse(Expression expression);
  }

  /** Looks up the annotation of a global. */
  @FunctionalInterface
  public interface GlobalResolver {
    @Nullable Annotation global(Access access);
  }

  /** Looks up a module by qualifier. */
  @FunctionalInterface
  public interface ModuleResolver {
    @Nullable ModuleDefinition moduleDefinition(Access access);
  }

  /** Looks up the definition of the class behind a type. */
  @FunctionalInterface
  public interface ClassDefinitionResolver {
    @Nullable ClassDefinition classDefinition(Type type);
  }

  /** Looks up the cached class model of the class behind a type. */
  @FunctionalInterface
  public interface ClassRepresentationResolver {
    @Nullable ClassRepresentation classRepresentation(Type type);
  }

  /** Computes the type produced by calling a class. */
  @FunctionalInterface
  public interface ConstructorResolver {
    Type constructor(Type instantiated, Resolution resolution, ClassDefinition definition);
  }

  public abstract ImmutableMap<Access, Annotation> annotations();

  public abstract TypeOrder order();

  abstract ExpressionResolver resolver();

  abstract RawAnnotationParser annotationParser();

  abstract GlobalResolver globals();

  abstract ModuleResolver modules();

  abstract ClassDefinitionResolver classDefinitions();

  abstract ClassRepresentationResolver classRepresentations();

  abstract ConstructorResolver constructors();

  /** The qualified name of the enclosing class or function, if any. */
  public abstract @Nullable Access parent();

  public static Builder builder() {
    return new AutoValue_Resolution.Builder().setAnnotations(ImmutableMap.of());
  }

  abstract Builder toBuilder();

  /** Builder for {@link Resolution}. Every capability must be supplied. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setAnnotations(Map<Access, Annotation> annotations);

    public abstract Builder setOrder(TypeOrder order);

    public abstract Builder setResolver(ExpressionResolver resolver);

    public abstract Builder setAnnotationParser(RawAnnotationParser annotationParser);

    public abstract Builder setGlobals(GlobalResolver globals);

    public abstract Builder setModules(ModuleResolver modules);

    public abstract Builder setClassDefinitions(ClassDefinitionResolver classDefinitions);

    public abstract Builder setClassRepresentations(
        ClassRepresentationResolver classRepresentations);

    public abstract Builder setConstructors(ConstructorResolver constructors);

    public abstract Builder setParent(@Nullable Access parent);

    public abstract Resolution build();
  }

  // Locals

  /** Returns a resolution in which {@code access} is annotated with {@code annotation}. */
  public final Resolution withLocal(Access access, Annotation annotation) {
    Map<Access, Annotation> annotations = new LinkedHashMap<>(annotations());
    annotations.put(access, annotation);
    return withAnnotations(annotations);
  }

  /** Returns a resolution without a local annotation for {@code access}. */
  public final Resolution withoutLocal(Access access) {
    if (!annotations().containsKey(access)) {
      return this;
    }
    Map<Access, Annotation> annotations = new LinkedHashMap<>(annotations());
    annotations.remove(access);
    return withAnnotations(annotations);
  }

  /** Same as {@link #getLocal(Access, boolean)} with global fallback. */
  public final @Nullable Annotation getLocal(Access access) {
    return getLocal(access, true);
  }

  /**
   * Returns the local annotation of {@code access}. A local that was deleted counts as absent.
   * Absent locals are looked up in the global table under their delocalized name when {@code
   * globalFallback} is set.
   */
  public final @Nullable Annotation getLocal(Access access, boolean globalFallback) {
    Annotation local = annotations().get(access);
    if (local != null && !local.annotation().equals(Type.DELETED)) {
      return local;
    }
    if (globalFallback) {
      return global(access.delocalize());
    }
    return null;
  }

  public final Resolution withAnnotations(Map<Access, Annotation> annotations) {
    return toBuilder().setAnnotations(annotations).build();
  }

  public final Resolution withParent(@Nullable Access parent) {
    return toBuilder().setParent(parent).build();
  }

  // Capabilities

  /** Resolves an arbitrary expression in this environment. */
  public final Type resolve(Expression expression) {
    return resolver().resolve(this, expression);
  }

  public final @Nullable Annotation global(Access access) {
    return globals().global(access);
  }

  public final @Nullable ModuleDefinition moduleDefinition(Access access) {
    return modules().moduleDefinition(access);
  }

  public final @Nullable ClassDefinition classDefinition(Type type) {
    return classDefinitions().classDefinition(type);
  }

  public final @Nullable ClassRepresentation classRepresentation(Type type) {
    return classRepresentations().classRepresentation(type);
  }

  /** The type produced by calling the class {@code definition}, instantiated as given. */
  public final Type constructor(Type instantiated, ClassDefinition definition) {
    return constructors().constructor(instantiated, this, definition);
  }

  /**
   * Returns the functions named {@code access} or nested under it. The module is the longest
   * prefix of {@code access} whose every prefix is a known module. Returns null if not even the
   * first element names a module.
   */
  public final @Nullable ImmutableList<FunctionDefinition> functionDefinitions(Access access) {
    int length = 0;
    while (length < access.size() && moduleDefinition(access.prefix(length + 1)) != null) {
      length++;
    }
    if (length == 0) {
      return null;
    }
    ModuleDefinition module = moduleDefinition(access.prefix(length));
    ImmutableList.Builder<FunctionDefinition> definitions = ImmutableList.builder();
    for (FunctionDefinition function : module.functions()) {
      Access name = function.name();
      if (name.size() >= access.size() && name.prefix(access.size()).equals(access)) {
        definitions.add(function);
      }
    }
    return definitions.build();
  }

  // Order

  public final boolean lessOrEqual(Type left, Type right) {
    return order().lessOrEqual(left, right);
  }

  public final Type join(Type left, Type right) {
    return order().join(left, right);
  }

  public final Type meet(Type left, Type right) {
    return order().meet(left, right);
  }

  public final Type widen(Type previous, Type next, int iteration) {
    return order().widen(previous, next, iteration);
  }

  public final boolean isInstantiated(Type type) {
    return order().isInstantiated(type);
  }

  public final boolean isTracked(Type type) {
    return order().contains(type);
  }

  /** Whether any nominal element of {@code type} is unknown to the order. */
  public final boolean containsUntracked(Type type) {
    for (Type element : type.nominalElements()) {
      if (!isTracked(element)) {
        return true;
      }
    }
    return false;
  }

  // Analyses

  /** Same as {@link #parseAnnotation(Expression, boolean)} without untracked types. */
  public final Type parseAnnotation(Expression expression) {
    return parseAnnotation(expression, false);
  }

  /**
   * Parses an annotation. References into empty stubs become {@code object}; unless {@code
   * allowUntracked} is set, an annotation mentioning any type unknown to the order is unknown as a
   * whole.
   */
  public final Type parseAnnotation(Expression expression, boolean allowUntracked) {
    return new AnnotationParser(this).parse(expression, allowUntracked);
  }

  /**
   * Whether {@code left} fails to be a subtype of {@code right} only because some invariant
   * parameter would have been accepted covariantly.
   */
  public final boolean isInvarianceMismatch(Type left, Type right) {
    return new InvarianceMismatchDetector(this).isInvarianceMismatch(left, right);
  }

  /** Infers the type of a literal without resolving any variables. */
  public final Type resolveLiteral(Expression expression) {
    return new LiteralTypeResolver(this).resolve(expression);
  }

  /**
   * Lets a container literal take the expected container type when its inferred element types
   * fit. {@code expression} is the syntax the type was resolved from, if known.
   */
  public final Type resolveMutableLiterals(
      @Nullable Expression expression, Type resolved, Type expected) {
    return new MutableLiteralResolver(this).resolve(expression, resolved, expected);
  }

  /**
   * Solves {@code source <= target} for the free variables of {@code target}, extending {@code
   * constraints}. Returns null if no solution exists.
   */
  public final @Nullable TypeConstraints solveConstraints(
      TypeConstraints constraints, Type source, Type target) {
    return new ConstraintSolver(this).solve(constraints, source, target);
  }

  public final boolean constraintsSolutionExists(Type source, Type target) {
    return solveConstraints(TypeConstraints.empty(), source, target) != null;
  }

  @Override
  public final String toString() {
    List<String> entries = new ArrayList<>();
    for (Map.Entry<Access, Annotation> entry : annotations().entrySet()) {
      entries.add(entry.getKey() + " -> " + entry.getValue());
    }
    return "[" + Joiner.on(", ").join(entries) + "]";
  }
}
