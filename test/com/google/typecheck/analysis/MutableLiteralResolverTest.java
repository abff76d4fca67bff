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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.google.typecheck.ast.Expression;
import com.google.typecheck.types.Type;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class MutableLiteralResolverTest extends ResolutionTestCase {
  private static final Expression INTEGERS =
      Expression.list(Expression.integer(1), Expression.integer(2), Expression.integer(3));

  @Test
  public void testListLiteralTakesExpectedType() {
    assertThat(
            resolution.resolveMutableLiterals(
                INTEGERS, Type.list(Type.INTEGER), Type.list(Type.FLOAT)))
        .isEqualTo(Type.list(Type.FLOAT));
  }

  @Test
  public void testIncompatibleElementsKeepResolvedType() {
    assertThat(
            resolution.resolveMutableLiterals(
                INTEGERS, Type.list(Type.INTEGER), Type.list(Type.STRING)))
        .isEqualTo(Type.list(Type.INTEGER));
  }

  @Test
  public void testOnlyLiteralsAreReconciled() {
    assertThat(
            resolution.resolveMutableLiterals(
                Expression.name("x"), Type.list(Type.INTEGER), Type.list(Type.FLOAT)))
        .isEqualTo(Type.list(Type.INTEGER));
    assertThat(
            resolution.resolveMutableLiterals(
                null, Type.list(Type.INTEGER), Type.list(Type.FLOAT)))
        .isEqualTo(Type.list(Type.INTEGER));
  }

  @Test
  public void testContainerKindsMustMatch() {
    assertThat(
            resolution.resolveMutableLiterals(
                INTEGERS, Type.list(Type.INTEGER), Type.set(Type.FLOAT)))
        .isEqualTo(Type.list(Type.INTEGER));
    assertThat(
            resolution.resolveMutableLiterals(INTEGERS, Type.list(Type.INTEGER), Type.OBJECT))
        .isEqualTo(Type.list(Type.INTEGER));
  }

  @Test
  public void testSetsAndComprehensions() {
    Expression set = Expression.set(Expression.trueLiteral());
    assertThat(
            resolution.resolveMutableLiterals(set, Type.set(Type.BOOL), Type.set(Type.INTEGER)))
        .isEqualTo(Type.set(Type.INTEGER));

    Expression comprehension = Expression.listComprehension(Expression.integer(1), INTEGERS);
    assertThat(
            resolution.resolveMutableLiterals(
                comprehension, Type.list(Type.INTEGER), Type.list(Type.COMPLEX)))
        .isEqualTo(Type.list(Type.COMPLEX));
  }

  @Test
  public void testDictionariesCheckKeysAndValues() {
    Expression dictionary =
        Expression.dictionary(
            ImmutableList.of(Maps.immutableEntry(Expression.string("a"), Expression.integer(1))));
    Type resolved = Type.dictionary(Type.STRING, Type.INTEGER);
    assertThat(
            resolution.resolveMutableLiterals(
                dictionary, resolved, Type.dictionary(Type.STRING, Type.FLOAT)))
        .isEqualTo(Type.dictionary(Type.STRING, Type.FLOAT));
    assertThat(
            resolution.resolveMutableLiterals(
                dictionary, resolved, Type.dictionary(Type.BYTES, Type.FLOAT)))
        .isEqualTo(resolved);
  }
}
