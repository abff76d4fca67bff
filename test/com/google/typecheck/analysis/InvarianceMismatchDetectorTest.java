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

import com.google.typecheck.testing.TestTypeOrder;
import com.google.typecheck.types.Type;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class InvarianceMismatchDetectorTest extends ResolutionTestCase {

  private static Type box(Type parameter) {
    return Type.parametric("Box", parameter);
  }

  @Test
  public void testCovariantUseOfInvariantParameter() {
    assertThat(resolution.lessOrEqual(box(Type.INTEGER), box(Type.OBJECT))).isFalse();
    assertThat(resolution.isInvarianceMismatch(box(Type.INTEGER), box(Type.OBJECT))).isTrue();
    assertThat(resolution.isInvarianceMismatch(Type.list(Type.BOOL), Type.list(Type.FLOAT)))
        .isTrue();
  }

  @Test
  public void testUnrelatedParameters() {
    assertThat(resolution.isInvarianceMismatch(box(Type.STRING), box(Type.INTEGER))).isFalse();
    assertThat(resolution.isInvarianceMismatch(box(Type.FLOAT), box(Type.INTEGER))).isFalse();
  }

  @Test
  public void testCovariantParameter() {
    assertThat(
            resolution.isInvarianceMismatch(
                TestTypeOrder.iterable(Type.INTEGER), TestTypeOrder.iterable(Type.FLOAT)))
        .isFalse();
  }

  @Test
  public void testDifferentGenerics() {
    assertThat(resolution.isInvarianceMismatch(Type.list(Type.INTEGER), Type.set(Type.FLOAT)))
        .isFalse();
    assertThat(resolution.isInvarianceMismatch(Type.INTEGER, Type.FLOAT)).isFalse();
  }

  @Test
  public void testArityMismatch() {
    assertThat(
            resolution.isInvarianceMismatch(
                Type.parametric("Box", Type.INTEGER, Type.INTEGER), box(Type.FLOAT)))
        .isFalse();
  }
}
