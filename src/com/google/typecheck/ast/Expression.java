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

package com.google.typecheck.ast;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * An immutable expression tree. Like a parse node, an expression is a {@link Kind} plus children;
 * kind-specific payloads (the access of an {@link Kind#ACCESS}, the text of a literal) live in
 * nullable slots that are only set for the kinds that use them.
 *
 * <p>Child layout by kind:
 *
 * <ul>
 *   <li>{@code AWAIT}, {@code STARRED}, {@code LAMBDA}, {@code UNARY_OPERATOR}: the operand.
 *   <li>{@code YIELD}: the yielded value, if any.
 *   <li>{@code BOOLEAN_OPERATOR}: left, right.
 *   <li>{@code TERNARY}: target, test, alternative.
 *   <li>{@code LIST}, {@code SET}, {@code TUPLE}: the elements.
 *   <li>{@code DICTIONARY}: alternating keys and values; {@code **} splats are in {@link
 *       #keywords}.
 *   <li>Comprehensions: the element (key and value for dictionaries), then the iterable.
 * </ul>
 */
@AutoValue
public abstract class Expression {

  /** The syntactic shape of an expression. */
  public enum Kind {
    ACCESS,
    AWAIT,
    BOOLEAN_OPERATOR,
    COMPARISON,
    COMPLEX,
    DICTIONARY,
    DICTIONARY_COMPREHENSION,
    ELLIPSIS,
    FALSE,
    FLOAT,
    GENERATOR,
    INTEGER,
    LAMBDA,
    LIST,
    LIST_COMPREHENSION,
    SET,
    SET_COMPREHENSION,
    STARRED,
    STRING,
    TERNARY,
    TRUE,
    TUPLE,
    UNARY_OPERATOR,
    YIELD
  }

  /** Flavor of a string literal. */
  public enum StringKind {
    STRING,
    BYTES,
    FORMAT
  }

  /** The short-circuiting operators. */
  public enum BooleanOperator {
    AND("and"),
    OR("or");

    private final String text;

    BooleanOperator(String text) {
      this.text = text;
    }

    @Override
    public String toString() {
      return text;
    }
  }

  public abstract Kind kind();

  public abstract ImmutableList<Expression> children();

  /** Dictionary splat entries ({@code **value}); empty for every other kind. */
  public abstract ImmutableList<Expression> keywords();

  abstract @Nullable Access maybeAccess();

  /** Source text of literals and the operator of boolean and comparison operators. */
  abstract @Nullable String maybeValue();

  abstract @Nullable StringKind maybeStringKind();

  private static Expression create(Kind kind, List<Expression> children) {
    return create(kind, children, null);
  }

  private static Expression create(Kind kind, List<Expression> children, @Nullable String value) {
    return new AutoValue_Expression(
        kind, ImmutableList.copyOf(children), ImmutableList.of(), null, value, null);
  }

  // Factories

  public static Expression access(Access access) {
    return new AutoValue_Expression(
        Kind.ACCESS, ImmutableList.of(), ImmutableList.of(), checkNotNull(access), null, null);
  }

  /** A dotted name such as {@code typing.List}. */
  public static Expression name(String name) {
    return access(Access.create(name));
  }

  public static Expression integer(long value) {
    return create(Kind.INTEGER, ImmutableList.of(), Long.toString(value));
  }

  public static Expression floatLiteral(double value) {
    return create(Kind.FLOAT, ImmutableList.of(), Double.toString(value));
  }

  public static Expression complex(double imaginary) {
    return create(Kind.COMPLEX, ImmutableList.of(), Double.toString(imaginary) + "j");
  }

  public static Expression string(String value) {
    return string(value, StringKind.STRING);
  }

  public static Expression bytes(String value) {
    return string(value, StringKind.BYTES);
  }

  public static Expression string(String value, StringKind kind) {
    return new AutoValue_Expression(
        Kind.STRING, ImmutableList.of(), ImmutableList.of(), null, value, kind);
  }

  public static Expression trueLiteral() {
    return create(Kind.TRUE, ImmutableList.of());
  }

  public static Expression falseLiteral() {
    return create(Kind.FALSE, ImmutableList.of());
  }

  public static Expression ellipsis() {
    return create(Kind.ELLIPSIS, ImmutableList.of());
  }

  public static Expression await(Expression operand) {
    return create(Kind.AWAIT, ImmutableList.of(operand));
  }

  public static Expression starred(Expression operand) {
    return create(Kind.STARRED, ImmutableList.of(operand));
  }

  public static Expression lambda(Expression body) {
    return create(Kind.LAMBDA, ImmutableList.of(body));
  }

  public static Expression not(Expression operand) {
    return create(Kind.UNARY_OPERATOR, ImmutableList.of(operand), "not");
  }

  public static Expression yield(@Nullable Expression value) {
    return create(Kind.YIELD, value == null ? ImmutableList.of() : ImmutableList.of(value));
  }

  public static Expression booleanOperator(
      Expression left, BooleanOperator operator, Expression right) {
    return create(Kind.BOOLEAN_OPERATOR, ImmutableList.of(left, right), operator.toString());
  }

  public static Expression comparison(Expression left, String operator, Expression right) {
    return create(Kind.COMPARISON, ImmutableList.of(left, right), operator);
  }

  /** {@code target if test else alternative}. */
  public static Expression ternary(Expression target, Expression test, Expression alternative) {
    return create(Kind.TERNARY, ImmutableList.of(target, test, alternative));
  }

  public static Expression list(Expression... elements) {
    return create(Kind.LIST, Arrays.asList(elements));
  }

  public static Expression list(List<Expression> elements) {
    return create(Kind.LIST, elements);
  }

  public static Expression set(Expression... elements) {
    return create(Kind.SET, Arrays.asList(elements));
  }

  public static Expression tuple(Expression... elements) {
    return create(Kind.TUPLE, Arrays.asList(elements));
  }

  public static Expression tuple(List<Expression> elements) {
    return create(Kind.TUPLE, elements);
  }

  public static Expression dictionary(List<Map.Entry<Expression, Expression>> entries) {
    return dictionary(entries, ImmutableList.of());
  }

  public static Expression dictionary(
      List<Map.Entry<Expression, Expression>> entries, List<Expression> keywords) {
    List<Expression> children = new ArrayList<>();
    for (Map.Entry<Expression, Expression> entry : entries) {
      children.add(entry.getKey());
      children.add(entry.getValue());
    }
    return new AutoValue_Expression(
        Kind.DICTIONARY,
        ImmutableList.copyOf(children),
        ImmutableList.copyOf(keywords),
        null,
        null,
        null);
  }

  public static Expression listComprehension(Expression element, Expression iterable) {
    return create(Kind.LIST_COMPREHENSION, ImmutableList.of(element, iterable));
  }

  public static Expression setComprehension(Expression element, Expression iterable) {
    return create(Kind.SET_COMPREHENSION, ImmutableList.of(element, iterable));
  }

  public static Expression generator(Expression element, Expression iterable) {
    return create(Kind.GENERATOR, ImmutableList.of(element, iterable));
  }

  public static Expression dictionaryComprehension(
      Expression key, Expression value, Expression iterable) {
    return create(Kind.DICTIONARY_COMPREHENSION, ImmutableList.of(key, value, iterable));
  }

  // Accessors

  public final boolean isAccess() {
    return kind() == Kind.ACCESS;
  }

  public final Access getAccess() {
    Access access = maybeAccess();
    checkState(access != null, "Not an access: %s", this);
    return access;
  }

  public final StringKind getStringKind() {
    StringKind stringKind = maybeStringKind();
    checkState(stringKind != null, "Not a string literal: %s", this);
    return stringKind;
  }

  public final Expression getChild(int index) {
    return children().get(index);
  }

  public final Expression getFirstChild() {
    checkState(!children().isEmpty(), "No children: %s", this);
    return children().get(0);
  }

  public final Expression getLastChild() {
    checkState(!children().isEmpty(), "No children: %s", this);
    return children().get(children().size() - 1);
  }

  /** Key/value pairs of a dictionary literal, in source order. */
  public final ImmutableList<Map.Entry<Expression, Expression>> getDictionaryEntries() {
    checkState(kind() == Kind.DICTIONARY, "Not a dictionary: %s", this);
    ImmutableList.Builder<Map.Entry<Expression, Expression>> entries = ImmutableList.builder();
    for (int i = 0; i + 1 < children().size(); i += 2) {
      entries.add(Maps.immutableEntry(children().get(i), children().get(i + 1)));
    }
    return entries.build();
  }

  /** Returns a copy in which every access has synthesized local names mapped back. */
  public final Expression delocalize() {
    if (isAccess()) {
      return access(getAccess().delocalize());
    }
    List<Expression> children = new ArrayList<>();
    for (Expression child : children()) {
      children.add(child.delocalize());
    }
    List<Expression> keywords = new ArrayList<>();
    for (Expression keyword : keywords()) {
      keywords.add(keyword.delocalize());
    }
    return new AutoValue_Expression(
        kind(),
        ImmutableList.copyOf(children),
        ImmutableList.copyOf(keywords),
        null,
        maybeValue(),
        maybeStringKind());
  }

  /** Renders the expression as source text. */
  @Override
  public final String toString() {
    switch (kind()) {
      case ACCESS:
        return getAccess().toString();
      case INTEGER:
      case FLOAT:
      case COMPLEX:
        return maybeValue();
      case STRING:
        String quoted = "\"" + maybeValue() + "\"";
        switch (getStringKind()) {
          case BYTES:
            return "b" + quoted;
          case FORMAT:
            return "f" + quoted;
          default:
            return quoted;
        }
      case TRUE:
        return "True";
      case FALSE:
        return "False";
      case ELLIPSIS:
        return "...";
      case AWAIT:
        return "await " + getFirstChild();
      case STARRED:
        return "*" + getFirstChild();
      case LAMBDA:
        return "lambda: " + getFirstChild();
      case UNARY_OPERATOR:
        return maybeValue() + " " + getFirstChild();
      case YIELD:
        return children().isEmpty() ? "yield" : "yield " + getFirstChild();
      case BOOLEAN_OPERATOR:
      case COMPARISON:
        return getChild(0) + " " + maybeValue() + " " + getChild(1);
      case TERNARY:
        return getChild(0) + " if " + getChild(1) + " else " + getChild(2);
      case LIST:
        return "[" + Joiner.on(", ").join(children()) + "]";
      case SET:
        return "{" + Joiner.on(", ").join(children()) + "}";
      case TUPLE:
        return "(" + Joiner.on(", ").join(children()) + ")";
      case DICTIONARY:
        List<String> entries = new ArrayList<>();
        for (Map.Entry<Expression, Expression> entry : getDictionaryEntries()) {
          entries.add(entry.getKey() + ": " + entry.getValue());
        }
        for (Expression keyword : keywords()) {
          entries.add("**" + keyword);
        }
        return "{" + Joiner.on(", ").join(entries) + "}";
      case LIST_COMPREHENSION:
        return "[" + getChild(0) + " for _ in " + getChild(1) + "]";
      case SET_COMPREHENSION:
        return "{" + getChild(0) + " for _ in " + getChild(1) + "}";
      case GENERATOR:
        return "(" + getChild(0) + " for _ in " + getChild(1) + ")";
      case DICTIONARY_COMPREHENSION:
        return "{" + getChild(0) + ": " + getChild(1) + " for _ in " + getChild(2) + "}";
    }
    throw new IllegalStateException("Unexpected kind " + kind());
  }
}
