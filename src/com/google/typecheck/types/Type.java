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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;

/**
 * A type as seen by the checker. This is a closed sum: every instance has exactly one {@link
 * Kind}, and code that inspects types is expected to switch over the kind exhaustively.
 *
 * <p>Types are immutable and compare structurally, so they may be used as map keys. The only
 * instances compared by identity are the singletons {@link #TOP}, {@link #BOTTOM}, {@link #OBJECT}
 * and {@link #DELETED}.
 */
public abstract class Type {

  /** The variant of a type. */
  public enum Kind {
    TOP,
    BOTTOM,
    OBJECT,
    DELETED,
    PRIMITIVE,
    PARAMETRIC,
    UNION,
    OPTIONAL,
    TUPLE,
    CALLABLE,
    VARIABLE,
    META
  }

  /** Declared variance of a type variable. */
  public enum Variance {
    COVARIANT,
    CONTRAVARIANT,
    INVARIANT
  }

  /** The unknown type. Anything may flow into and out of it. */
  public static final Type TOP = new Singleton(Kind.TOP, "unknown");

  /** The type of a variable that has not been assigned on some path. */
  public static final Type BOTTOM = new Singleton(Kind.BOTTOM, "undefined");

  /** The supertype of every known type. */
  public static final Type OBJECT = new Singleton(Kind.OBJECT, "object");

  /** Marks a local that was explicitly deleted. */
  public static final Type DELETED = new Singleton(Kind.DELETED, "deleted");

  public static final Type BOOL = primitive("bool");
  public static final Type BYTES = primitive("bytes");
  public static final Type COMPLEX = primitive("complex");
  public static final Type FLOAT = primitive("float");
  public static final Type INTEGER = primitive("int");
  public static final Type STRING = primitive("str");

  /** The type of {@code None}, represented as an optional with nothing inside. */
  public static final Type NONE = new AutoValue_Type_Optional(BOTTOM);

  public static final String AWAITABLE_NAME = "typing.Awaitable";
  public static final String DICTIONARY_NAME = "dict";
  public static final String LIST_NAME = "list";
  public static final String SET_NAME = "set";
  public static final String YIELD_NAME = "Yield";

  private Type() {}

  public abstract Kind kind();

  // Factories

  public static Primitive primitive(String name) {
    return new AutoValue_Type_Primitive(checkNotNull(name));
  }

  public static Parametric parametric(String name, List<Type> parameters) {
    return new AutoValue_Type_Parametric(checkNotNull(name), ImmutableList.copyOf(parameters));
  }

  public static Parametric parametric(String name, Type... parameters) {
    return parametric(name, Arrays.asList(parameters));
  }

  public static Parametric list(Type parameter) {
    return parametric(LIST_NAME, parameter);
  }

  public static Parametric set(Type parameter) {
    return parametric(SET_NAME, parameter);
  }

  public static Parametric dictionary(Type key, Type value) {
    return parametric(DICTIONARY_NAME, key, value);
  }

  public static Parametric awaitable(Type parameter) {
    return parametric(AWAITABLE_NAME, parameter);
  }

  public static Parametric yield(Type parameter) {
    return parametric(YIELD_NAME, parameter);
  }

  public static Type meta(Type instance) {
    return new AutoValue_Type_Meta(instance);
  }

  public static Tuple tuple(List<Type> elements) {
    return new AutoValue_Type_BoundedTuple(ImmutableList.copyOf(elements));
  }

  public static Tuple tuple(Type... elements) {
    return tuple(Arrays.asList(elements));
  }

  public static Tuple unboundedTuple(Type element) {
    return new AutoValue_Type_UnboundedTuple(element);
  }

  public static Variable variable(String name) {
    return variable(name, VariableConstraints.UNCONSTRAINED, Variance.INVARIANT);
  }

  public static Variable variable(String name, VariableConstraints constraints) {
    return variable(name, constraints, Variance.INVARIANT);
  }

  public static Variable variable(
      String name, VariableConstraints constraints, Variance variance) {
    return new AutoValue_Type_Variable(checkNotNull(name), constraints, variance);
  }

  public static Callable callable(Callable.Signature implementation) {
    return callable(implementation, ImmutableList.of());
  }

  public static Callable callable(
      Callable.Signature implementation, List<Callable.Signature> overloads) {
    return new AutoValue_Type_Callable(implementation, ImmutableList.copyOf(overloads));
  }

  /**
   * Returns {@code Optional[parameter]}. Optionals do not nest, and an optional unknown is just
   * unknown.
   */
  public static Type optional(Type parameter) {
    switch (parameter.kind()) {
      case TOP:
      case OPTIONAL:
        return parameter;
      default:
        return new AutoValue_Type_Optional(parameter);
    }
  }

  public static Type union(Type... members) {
    return union(Arrays.asList(members));
  }

  /**
   * Builds a normalized union. Nested unions are flattened, duplicates and {@link #BOTTOM} are
   * dropped, {@link #TOP} and {@link #OBJECT} absorb everything, and a union with a single member
   * is that member. Optional members make the whole union optional.
   */
  public static Type union(Iterable<? extends Type> members) {
    Set<Type> flattened = new LinkedHashSet<>();
    boolean optional = false;
    List<Type> worklist = new ArrayList<>();
    for (Type member : members) {
      worklist.add(member);
    }
    while (!worklist.isEmpty()) {
      Type member = worklist.remove(0);
      switch (member.kind()) {
        case UNION:
          worklist.addAll(member.toMaybeUnion().members());
          break;
        case OPTIONAL:
          optional = true;
          worklist.add(member.toMaybeOptional().inner());
          break;
        case BOTTOM:
          break;
        default:
          flattened.add(member);
      }
    }
    if (flattened.contains(TOP)) {
      return TOP;
    }
    if (flattened.contains(OBJECT)) {
      return OBJECT;
    }
    Type result;
    if (flattened.isEmpty()) {
      result = BOTTOM;
    } else if (flattened.size() == 1) {
      result = flattened.iterator().next();
    } else {
      List<Type> sorted = new ArrayList<>(flattened);
      sorted.sort(Comparator.comparing(Type::show));
      result = new AutoValue_Type_Union(ImmutableSet.copyOf(sorted));
    }
    return optional ? optional(result) : result;
  }

  // Kind tests

  public final boolean isTop() {
    return kind() == Kind.TOP;
  }

  public final boolean isBottom() {
    return kind() == Kind.BOTTOM;
  }

  public final boolean isObject() {
    return kind() == Kind.OBJECT;
  }

  public final boolean isPrimitive() {
    return kind() == Kind.PRIMITIVE;
  }

  public final boolean isParametric() {
    return kind() == Kind.PARAMETRIC;
  }

  public final boolean isUnion() {
    return kind() == Kind.UNION;
  }

  public final boolean isOptional() {
    return kind() == Kind.OPTIONAL;
  }

  public final boolean isTuple() {
    return kind() == Kind.TUPLE;
  }

  public final boolean isCallable() {
    return kind() == Kind.CALLABLE;
  }

  public final boolean isVariable() {
    return kind() == Kind.VARIABLE;
  }

  public final boolean isMeta() {
    return kind() == Kind.META;
  }

  public final boolean isNone() {
    return equals(NONE);
  }

  // Downcasts. Each returns null unless the type has the matching kind.

  public @Nullable Primitive toMaybePrimitive() {
    return null;
  }

  public @Nullable Parametric toMaybeParametric() {
    return null;
  }

  public @Nullable Union toMaybeUnion() {
    return null;
  }

  public @Nullable Optional toMaybeOptional() {
    return null;
  }

  public @Nullable Tuple toMaybeTuple() {
    return null;
  }

  public @Nullable Callable toMaybeCallable() {
    return null;
  }

  public @Nullable Variable toMaybeVariable() {
    return null;
  }

  public @Nullable Meta toMaybeMeta() {
    return null;
  }

  /** Returns the types directly nested in this one. Variable bounds are not children. */
  public ImmutableList<Type> children() {
    return ImmutableList.of();
  }

  /** Returns whether this type or any nested type satisfies the predicate. */
  public final boolean exists(Predicate<Type> predicate) {
    if (predicate.test(this)) {
      return true;
    }
    for (Type child : children()) {
      if (child.exists(predicate)) {
        return true;
      }
    }
    return false;
  }

  /** Whether this type contains no free type variables. */
  public final boolean isResolved() {
    return !exists(Type::isVariable);
  }

  /**
   * Whether this type is fully known: it contains neither {@link #TOP} nor {@link #BOTTOM}, except
   * that the {@code None} type counts as known.
   */
  public final boolean isConcrete() {
    switch (kind()) {
      case TOP:
      case BOTTOM:
        return false;
      case OPTIONAL:
        Type inner = toMaybeOptional().inner();
        return inner.isBottom() || inner.isConcrete();
      default:
        for (Type child : children()) {
          if (!child.isConcrete()) {
            return false;
          }
        }
        return true;
    }
  }

  /**
   * Returns the nominal types mentioned by this type: every primitive, and the generic name of
   * every parametric type as a primitive. These are what the lattice has to know about.
   */
  public final ImmutableList<Type> nominalElements() {
    ImmutableList.Builder<Type> elements = ImmutableList.builder();
    collectElements(elements);
    return elements.build();
  }

  private void collectElements(ImmutableList.Builder<Type> elements) {
    if (isPrimitive()) {
      elements.add(this);
    } else if (isParametric()) {
      elements.add(primitive(toMaybeParametric().name()));
    }
    for (Type child : children()) {
      child.collectElements(elements);
    }
  }

  /** Returns the distinct free variables of this type, in order of first occurrence. */
  public final ImmutableList<Variable> variables() {
    Set<Variable> variables = new LinkedHashSet<>();
    exists(
        type -> {
          if (type.isVariable()) {
            variables.add(type.toMaybeVariable());
          }
          return false;
        });
    return ImmutableList.copyOf(variables);
  }

  /**
   * Replaces subtrees of this type. The replacement function is consulted top-down; a non-null
   * result replaces the whole subtree without visiting its children.
   */
  public final Type instantiate(Function<Type, @Nullable Type> replacement) {
    Type replaced = replacement.apply(this);
    if (replaced != null) {
      return replaced;
    }
    return rebuild(replacement);
  }

  /** Rebuilds this type with instantiated children. Leaves return themselves. */
  Type rebuild(Function<Type, @Nullable Type> replacement) {
    return this;
  }

  private static ImmutableList<Type> instantiateAll(
      List<Type> types, Function<Type, @Nullable Type> replacement) {
    ImmutableList.Builder<Type> result = ImmutableList.builder();
    for (Type type : types) {
      result.add(type.instantiate(replacement));
    }
    return result.build();
  }

  /** For {@code typing.Awaitable[T]} returns {@code T}; anything else awaits to unknown. */
  public final Type awaitableValue() {
    Parametric parametric = toMaybeParametric();
    if (parametric != null
        && parametric.name().equals(AWAITABLE_NAME)
        && parametric.parameters().size() == 1) {
      return parametric.parameters().get(0);
    }
    return TOP;
  }

  /** Returns the only parameter of a meta type or of a single-parameter generic. */
  public final Type singleParameter() {
    if (isMeta()) {
      return toMaybeMeta().instance();
    }
    Parametric parametric = toMaybeParametric();
    checkState(
        parametric != null && parametric.parameters().size() == 1,
        "%s does not have a single parameter",
        this);
    return parametric.parameters().get(0);
  }

  @Override
  public String toString() {
    return show();
  }

  abstract String show();

  private static String showAll(List<Type> types) {
    List<String> shown = new ArrayList<>();
    for (Type type : types) {
      shown.add(type.show());
    }
    return Joiner.on(", ").join(shown);
  }

  private static final class Singleton extends Type {
    private final Kind kind;
    private final String name;

    Singleton(Kind kind, String name) {
      this.kind = kind;
      this.name = name;
    }

    @Override
    public Kind kind() {
      return kind;
    }

    @Override
    String show() {
      return name;
    }
  }

  /** A nominal type without parameters, such as {@code int}. */
  @AutoValue
  public abstract static class Primitive extends Type {
    public abstract String name();

    @Override
    public Kind kind() {
      return Kind.PRIMITIVE;
    }

    @Override
    public Primitive toMaybePrimitive() {
      return this;
    }

    @Override
    String show() {
      return name();
    }
  }

  /** An instantiation of a generic nominal type, such as {@code list[int]}. */
  @AutoValue
  public abstract static class Parametric extends Type {
    public abstract String name();

    public abstract ImmutableList<Type> parameters();

    @Override
    public Kind kind() {
      return Kind.PARAMETRIC;
    }

    @Override
    public Parametric toMaybeParametric() {
      return this;
    }

    @Override
    public ImmutableList<Type> children() {
      return parameters();
    }

    @Override
    Type rebuild(Function<Type, @Nullable Type> replacement) {
      return parametric(name(), instantiateAll(parameters(), replacement));
    }

    @Override
    String show() {
      return name() + "[" + showAll(parameters()) + "]";
    }
  }

  /**
   * A normalized union of at least two members, none of which is a union or optional. Members are
   * kept sorted by their printed form, so equal unions iterate in the same order.
   */
  @AutoValue
  public abstract static class Union extends Type {
    public abstract ImmutableSet<Type> members();

    @Override
    public Kind kind() {
      return Kind.UNION;
    }

    @Override
    public Union toMaybeUnion() {
      return this;
    }

    @Override
    public ImmutableList<Type> children() {
      return members().asList();
    }

    @Override
    Type rebuild(Function<Type, @Nullable Type> replacement) {
      return union(instantiateAll(members().asList(), replacement));
    }

    @Override
    String show() {
      return "typing.Union[" + showAll(members().asList()) + "]";
    }
  }

  /** {@code Optional[T]}; {@code Optional[Bottom]} is the type of {@code None}. */
  @AutoValue
  public abstract static class Optional extends Type {
    public abstract Type inner();

    @Override
    public Kind kind() {
      return Kind.OPTIONAL;
    }

    @Override
    public Optional toMaybeOptional() {
      return this;
    }

    @Override
    public ImmutableList<Type> children() {
      return ImmutableList.of(inner());
    }

    @Override
    Type rebuild(Function<Type, @Nullable Type> replacement) {
      return optional(inner().instantiate(replacement));
    }

    @Override
    String show() {
      return inner().isBottom() ? "None" : "typing.Optional[" + inner().show() + "]";
    }
  }

  /** A tuple, either of fixed length with positional element types or of any length. */
  public abstract static class Tuple extends Type {
    private Tuple() {}

    @Override
    public final Kind kind() {
      return Kind.TUPLE;
    }

    @Override
    public final Tuple toMaybeTuple() {
      return this;
    }

    public abstract boolean isBounded();

    /** Element types of a bounded tuple. */
    public ImmutableList<Type> elements() {
      throw new IllegalStateException("Unbounded tuple has no positional elements: " + this);
    }

    /** Element type of an unbounded tuple. */
    public Type element() {
      throw new IllegalStateException("Bounded tuple has no single element type: " + this);
    }
  }

  /** {@code Tuple[A, B, C]}. */
  @AutoValue
  public abstract static class BoundedTuple extends Tuple {
    @Override
    public abstract ImmutableList<Type> elements();

    @Override
    public boolean isBounded() {
      return true;
    }

    @Override
    public ImmutableList<Type> children() {
      return elements();
    }

    @Override
    Type rebuild(Function<Type, @Nullable Type> replacement) {
      return tuple(instantiateAll(elements(), replacement));
    }

    @Override
    String show() {
      return "typing.Tuple[" + showAll(elements()) + "]";
    }
  }

  /** {@code Tuple[A, ...]}. */
  @AutoValue
  public abstract static class UnboundedTuple extends Tuple {
    @Override
    public abstract Type element();

    @Override
    public boolean isBounded() {
      return false;
    }

    @Override
    public ImmutableList<Type> children() {
      return ImmutableList.of(element());
    }

    @Override
    Type rebuild(Function<Type, @Nullable Type> replacement) {
      return unboundedTuple(element().instantiate(replacement));
    }

    @Override
    String show() {
      return "typing.Tuple[" + element().show() + ", ...]";
    }
  }

  /** A callable value: an implementation signature plus any declared overloads. */
  @AutoValue
  public abstract static class Callable extends Type {
    public abstract Signature implementation();

    public abstract ImmutableList<Signature> overloads();

    @Override
    public Kind kind() {
      return Kind.CALLABLE;
    }

    @Override
    public Callable toMaybeCallable() {
      return this;
    }

    @Override
    public ImmutableList<Type> children() {
      ImmutableList.Builder<Type> children = ImmutableList.builder();
      implementation().addTypes(children);
      for (Signature overload : overloads()) {
        overload.addTypes(children);
      }
      return children.build();
    }

    @Override
    Type rebuild(Function<Type, @Nullable Type> replacement) {
      ImmutableList.Builder<Signature> overloads = ImmutableList.builder();
      for (Signature overload : overloads()) {
        overloads.add(overload.instantiate(replacement));
      }
      return callable(implementation().instantiate(replacement), overloads.build());
    }

    @Override
    String show() {
      return implementation().show();
    }

    /** How a parameter receives arguments. */
    public enum ParameterKind {
      NAMED,
      VARIABLE,
      KEYWORDS
    }

    /** A single declared parameter. */
    @AutoValue
    public abstract static class Parameter {
      public abstract String name();

      public abstract Type annotation();

      public abstract ParameterKind kind();

      public abstract boolean hasDefault();

      public static Parameter named(String name, Type annotation) {
        return create(name, annotation, ParameterKind.NAMED, false);
      }

      public static Parameter create(
          String name, Type annotation, ParameterKind kind, boolean hasDefault) {
        return new AutoValue_Type_Callable_Parameter(name, annotation, kind, hasDefault);
      }

      Parameter withAnnotation(Type annotation) {
        return create(name(), annotation, kind(), hasDefault());
      }
    }

    /**
     * A return annotation plus parameters. Parameters are null when undefined, i.e. the callable
     * accepts any arguments.
     */
    @AutoValue
    public abstract static class Signature {
      public abstract Type annotation();

      public abstract @Nullable ImmutableList<Parameter> parameters();

      public static Signature create(Type annotation, List<Parameter> parameters) {
        return new AutoValue_Type_Callable_Signature(annotation, ImmutableList.copyOf(parameters));
      }

      public static Signature undefined(Type annotation) {
        return new AutoValue_Type_Callable_Signature(annotation, null);
      }

      /** Annotations of the defined parameters, in order; empty for undefined parameters. */
      public ImmutableList<Type> parameterAnnotations() {
        ImmutableList<Parameter> parameters = parameters();
        if (parameters == null) {
          return ImmutableList.of();
        }
        ImmutableList.Builder<Type> annotations = ImmutableList.builder();
        for (Parameter parameter : parameters) {
          annotations.add(parameter.annotation());
        }
        return annotations.build();
      }

      void addTypes(ImmutableList.Builder<Type> types) {
        types.add(annotation());
        types.addAll(parameterAnnotations());
      }

      Signature instantiate(Function<Type, @Nullable Type> replacement) {
        Type annotation = annotation().instantiate(replacement);
        ImmutableList<Parameter> parameters = parameters();
        if (parameters == null) {
          return undefined(annotation);
        }
        ImmutableList.Builder<Parameter> instantiated = ImmutableList.builder();
        for (Parameter parameter : parameters) {
          Type parameterAnnotation = parameter.annotation().instantiate(replacement);
          instantiated.add(parameter.withAnnotation(parameterAnnotation));
        }
        return create(annotation, instantiated.build());
      }

      String show() {
        String parameters =
            parameters() == null ? "..." : "[" + showAll(parameterAnnotations()) + "]";
        return "typing.Callable[" + parameters + ", " + annotation().show() + "]";
      }
    }
  }

  /** A type parameter awaiting a binding. */
  @AutoValue
  public abstract static class Variable extends Type {
    public abstract String name();

    public abstract VariableConstraints constraints();

    public abstract Variance variance();

    @Override
    public Kind kind() {
      return Kind.VARIABLE;
    }

    @Override
    public Variable toMaybeVariable() {
      return this;
    }

    @Override
    String show() {
      return name();
    }
  }

  /** The class object of a type, as opposed to an instance of it. */
  @AutoValue
  public abstract static class Meta extends Type {
    public abstract Type instance();

    @Override
    public Kind kind() {
      return Kind.META;
    }

    @Override
    public Meta toMaybeMeta() {
      return this;
    }

    @Override
    public ImmutableList<Type> children() {
      return ImmutableList.of(instance());
    }

    @Override
    Type rebuild(Function<Type, @Nullable Type> replacement) {
      return meta(instance().instantiate(replacement));
    }

    @Override
    String show() {
      return "typing.Type[" + instance().show() + "]";
    }
  }
}
