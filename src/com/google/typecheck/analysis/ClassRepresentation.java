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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.typecheck.ast.Access;
import com.google.typecheck.ast.Attribute;
import com.google.typecheck.ast.ClassDefinition;
import com.google.typecheck.types.Type;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The class model's cached view of a class: its definition, linearized ancestors and attribute
 * tables. Owned by the class model; the analysis only reads it.
 */
@AutoValue
public abstract class ClassRepresentation {
  public abstract ClassDefinition classDefinition();

  /** Ancestors in method resolution order, excluding the class itself. */
  public abstract ImmutableList<Type> successors();

  /** Attributes declared in the class body. */
  public abstract ImmutableMap<Access, Attribute> explicitAttributes();

  /** Attributes inferred from assignments in methods, such as those made in the constructor. */
  public abstract ImmutableMap<Access, Attribute> implicitAttributes();

  public abstract boolean isTest();

  public abstract ImmutableList<Type> methods();

  public static Builder builder() {
    return new AutoValue_ClassRepresentation.Builder()
        .setSuccessors(ImmutableList.of())
        .setExplicitAttributes(ImmutableMap.of())
        .setImplicitAttributes(ImmutableMap.of())
        .setIsTest(false)
        .setMethods(ImmutableList.of());
  }

  /** Looks up an attribute, preferring the one declared in the class body. */
  public final @Nullable Attribute attribute(Access name) {
    Attribute explicit = explicitAttributes().get(name);
    return explicit != null ? explicit : implicitAttributes().get(name);
  }

  /** Builder for {@link ClassRepresentation}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setClassDefinition(ClassDefinition classDefinition);

    public abstract Builder setSuccessors(List<Type> successors);

    public abstract Builder setExplicitAttributes(Map<Access, Attribute> explicitAttributes);

    public abstract Builder setImplicitAttributes(Map<Access, Attribute> implicitAttributes);

    public abstract Builder setIsTest(boolean isTest);

    public abstract Builder setMethods(List<Type> methods);

    public abstract ClassRepresentation build();
  }
}
