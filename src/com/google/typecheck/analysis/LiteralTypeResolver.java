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
import com.google.typecheck.ast.Access;
import com.google.typecheck.ast.Expression;
import com.google.typecheck.types.Type;
import java.util.List;
import java.util.Map;

/**
 * Infers types of literals from their shape alone. Expressions may refer to themselves, so this
 * never evaluates names: a name only matters when it denotes a known class. Anything without a
 * literal shape is {@code object}.
 */
final class LiteralTypeResolver {
  private final Resolution resolution;

  LiteralTypeResolver(Resolution resolution) {
    this.resolution = resolution;
  }

  Type resolve(Expression expression) {
    switch (expression.kind()) {
      case ACCESS:
        return resolveAccess(expression);
      case AWAIT:
        return resolve(expression.getFirstChild()).awaitableValue();
      case BOOLEAN_OPERATOR:
        return concreteOrObject(
            resolution.join(resolve(expression.getChild(0)), resolve(expression.getChild(1))));
      case TERNARY:
        return concreteOrObject(
            resolution.join(resolve(expression.getChild(0)), resolve(expression.getChild(2))));
      case COMPLEX:
        return Type.COMPLEX;
      case FLOAT:
        return Type.FLOAT;
      case INTEGER:
        return Type.INTEGER;
      case TRUE:
      case FALSE:
        return Type.BOOL;
      case STRING:
        return expression.getStringKind() == Expression.StringKind.BYTES
            ? Type.BYTES
            : Type.STRING;
      case LIST:
        {
          Type parameter = joinAll(expression.children());
          return parameter.isConcrete() ? Type.list(parameter) : Type.OBJECT;
        }
      case SET:
        {
          Type parameter = joinAll(expression.children());
          return parameter.isConcrete() ? Type.set(parameter) : Type.OBJECT;
        }
      case DICTIONARY:
        return resolveDictionary(expression);
      case TUPLE:
        {
          ImmutableList.Builder<Type> elements = ImmutableList.builder();
          for (Expression element : expression.children()) {
            elements.add(resolve(element));
          }
          return Type.tuple(elements.build());
        }
      case YIELD:
        return Type.yield(Type.OBJECT);
      case COMPARISON:
      case DICTIONARY_COMPREHENSION:
      case ELLIPSIS:
      case GENERATOR:
      case LAMBDA:
      case LIST_COMPREHENSION:
      case SET_COMPREHENSION:
      case STARRED:
      case UNARY_OPERATOR:
        return Type.OBJECT;
    }
    throw new IllegalStateException("Unexpected expression " + expression);
  }

  /**
   * A call of a known class is an instance of it, and a bare reference to a known class is the
   * class object. {@code None} names the none type rather than a class.
   */
  private Type resolveAccess(Expression expression) {
    Access access = expression.getAccess();
    Access callee = access.callee();
    if (callee != null) {
      Type className = resolution.parseAnnotation(Expression.access(callee));
      return isDefined(className) ? className : Type.OBJECT;
    }
    if (access.isCall()) {
      return Type.OBJECT;
    }
    Type className = resolution.parseAnnotation(expression);
    if (className.isNone()) {
      return Type.NONE;
    }
    return isDefined(className) ? Type.meta(className) : Type.OBJECT;
  }

  private Type resolveDictionary(Expression expression) {
    if (!expression.keywords().isEmpty()) {
      return Type.OBJECT;
    }
    Type key = Type.BOTTOM;
    Type value = Type.BOTTOM;
    for (Map.Entry<Expression, Expression> entry : expression.getDictionaryEntries()) {
      key = resolution.join(key, resolve(entry.getKey()));
      value = resolution.join(value, resolve(entry.getValue()));
    }
    return key.isConcrete() && value.isConcrete() ? Type.dictionary(key, value) : Type.OBJECT;
  }

  private Type joinAll(List<Expression> elements) {
    Type joined = Type.BOTTOM;
    for (Expression element : elements) {
      joined = resolution.join(joined, resolve(element));
    }
    return joined;
  }

  private boolean isDefined(Type className) {
    return resolution.classDefinition(className) != null;
  }

  private static Type concreteOrObject(Type type) {
    return type.isConcrete() ? type : Type.OBJECT;
  }
}
