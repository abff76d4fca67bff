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
import org.jspecify.annotations.Nullable;

/** A function (or method) definition, named by its fully qualified name. */
@AutoValue
public abstract class FunctionDefinition {
  public abstract Access name();

  public abstract ImmutableList<String> parameterNames();

  public abstract @Nullable Expression returnAnnotation();

  /** Whether the definition comes from a stub and has no body. */
  public abstract boolean isStub();

  public static FunctionDefinition create(
      Access name,
      List<String> parameterNames,
      @Nullable Expression returnAnnotation,
      boolean isStub) {
    return new AutoValue_FunctionDefinition(
        name, ImmutableList.copyOf(parameterNames), returnAnnotation, isStub);
  }
}
