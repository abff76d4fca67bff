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

import com.google.typecheck.types.Type;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TypeConstraintsTest {
  private static final Type.Variable T = Type.variable("T");
  private static final Type.Variable U = Type.variable("U");

  @Test
  public void testEmpty() {
    assertThat(TypeConstraints.empty().isEmpty()).isTrue();
    assertThat(TypeConstraints.empty().get(T)).isNull();
  }

  @Test
  public void testWithDoesNotModify() {
    TypeConstraints first = TypeConstraints.of(T, Type.INTEGER);
    TypeConstraints second = first.with(T, Type.STRING).with(U, Type.BOOL);

    assertThat(first.get(T)).isEqualTo(Type.INTEGER);
    assertThat(first.get(U)).isNull();
    assertThat(second.get(T)).isEqualTo(Type.STRING);
    assertThat(second.asMap()).hasSize(2);
  }

  @Test
  public void testWithSameBindingIsIdentity() {
    TypeConstraints constraints = TypeConstraints.of(T, Type.INTEGER);
    assertThat(constraints.with(T, Type.INTEGER)).isSameInstanceAs(constraints);
  }

  @Test
  public void testInstantiate() {
    TypeConstraints constraints = TypeConstraints.of(T, Type.INTEGER);
    assertThat(constraints.instantiate(Type.dictionary(T, U)))
        .isEqualTo(Type.dictionary(Type.INTEGER, U));
    assertThat(constraints.instantiate(Type.optional(Type.list(T))))
        .isEqualTo(Type.optional(Type.list(Type.INTEGER)));
    assertThat(TypeConstraints.empty().instantiate(T)).isEqualTo(T);
  }
}
