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
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * What the checker knows about a module: its qualifier, whether it is an empty stub, and every
 * function defined in its source, nested ones included.
 */
@AutoValue
public abstract class ModuleDefinition {
  public abstract Access qualifier();

  /**
   * Whether the module is a stub that declares nothing. References into such a module are
   * accepted as {@code object}.
   */
  public abstract boolean isEmptyStub();

  public abstract ImmutableList<FunctionDefinition> functions();

  public static ModuleDefinition create(Access qualifier, List<FunctionDefinition> functions) {
    return new AutoValue_ModuleDefinition(qualifier, false, ImmutableList.copyOf(functions));
  }

  public static ModuleDefinition createEmptyStub(Access qualifier) {
    return new AutoValue_ModuleDefinition(qualifier, true, ImmutableList.of());
  }

  /**
   * Whether {@code access} points into an empty stub. Prefixes of the access are looked up from
   * the shortest one on; the walk stops at the first prefix that is not a known module.
   */
  public static boolean fromEmptyStub(
      Access access, Function<Access, @Nullable ModuleDefinition> moduleDefinition) {
    for (int length = 1; length <= access.size(); length++) {
      ModuleDefinition definition = moduleDefinition.apply(access.prefix(length));
      if (definition == null) {
        return false;
      }
      if (definition.isEmptyStub()) {
        return true;
      }
    }
    return false;
  }
}
