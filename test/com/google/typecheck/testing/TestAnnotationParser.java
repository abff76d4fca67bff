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

import com.google.common.collect.ImmutableList;
import com.google.typecheck.analysis.Resolution;
import com.google.typecheck.ast.Access;
import com.google.typecheck.ast.Expression;
import com.google.typecheck.types.Type;
import java.util.List;

/**
 * Parses annotations written as accesses, with subscripts spelled as calls of {@code
 * __getitem__}: {@code typing.Optional.__getitem__(int)}. Anything that is not an access is
 * unknown.
 */
public final class TestAnnotationParser implements Resolution.RawAnnotationParser {
  public static final String GET_ITEM = "__getitem__";

  /** Builds the annotation expression {@code name[parameters]}. */
  public static Expression subscript(String name, Expression... parameters) {
    Expression index =
        parameters.length == 1 ? parameters[0] : Expression.tuple(parameters);
    return Expression.access(
        Access.create(name).append(GET_ITEM).call(ImmutableList.of(index)));
  }

  @Override
  public Type parse(Expression expression) {
    if (!expression.isAccess()) {
      return Type.TOP;
    }
    Access access = expression.getAccess();
    Access callee = access.callee();
    if (callee != null
        && !callee.elements().get(callee.size() - 1).isCall()
        && callee.elements().get(callee.size() - 1).identifier().equals(GET_ITEM)
        && callee.size() > 1) {
      Expression index = access.callArguments().get(0);
      List<Expression> arguments =
          index.kind() == Expression.Kind.TUPLE ? index.children() : ImmutableList.of(index);
      return parseGeneric(callee.prefix(callee.size() - 1).toString(), arguments);
    }
    if (access.isCall()) {
      return Type.TOP;
    }
    switch (access.toString()) {
      case "None":
        return Type.NONE;
      case "typing.Any":
        return Type.TOP;
      case "object":
        return Type.OBJECT;
      default:
        return Type.primitive(access.toString());
    }
  }

  private Type parseGeneric(String name, List<Expression> arguments) {
    ImmutableList.Builder<Type> builder = ImmutableList.builder();
    for (Expression argument : arguments) {
      builder.add(parse(argument));
    }
    ImmutableList<Type> parameters = builder.build();
    switch (name) {
      case "typing.Optional":
        return Type.optional(parameters.get(0));
      case "typing.Union":
        return Type.union(parameters);
      case "typing.Type":
        return Type.meta(parameters.get(0));
      case "typing.Tuple":
        return Type.tuple(parameters);
      default:
        return Type.parametric(name, parameters);
    }
  }
}
