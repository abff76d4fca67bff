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
import org.jspecify.annotations.Nullable;

/** An attribute of a class, either declared in the body or assigned in a method. */
@AutoValue
public abstract class Attribute {
  public abstract Access name();

  public abstract @Nullable Expression annotation();

  public abstract @Nullable Expression value();

  public static Attribute create(
      Access name, @Nullable Expression annotation, @Nullable Expression value) {
    return new AutoValue_Attribute(name, annotation, value);
  }
}
