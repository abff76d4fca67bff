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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** A class definition: its qualified name, base class expressions and methods. */
@AutoValue
public abstract class ClassDefinition {
  public abstract Access name();

  public abstract ImmutableList<Expression> bases();

  public abstract ImmutableList<FunctionDefinition> methods();

  public static ClassDefinition create(Access name, List<Expression> bases) {
    return create(name, bases, ImmutableList.of());
  }

  public static ClassDefinition create(
      Access name, List<Expression> bases, List<FunctionDefinition> methods) {
    return new AutoValue_ClassDefinition(
        name, ImmutableList.copyOf(bases), ImmutableList.copyOf(methods));
  }
}
