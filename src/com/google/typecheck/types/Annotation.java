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

package com.google.typecheck.types;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.auto.value.AutoValue;
import org.jspecify.annotations.Nullable;

/**
 * The type recorded for a name, together with whether later assignments may replace it. A mutable
 * annotation is refined freely by assignments; an immutable one was declared explicitly and keeps
 * the declared type as its {@link #original}.
 */
@AutoValue
public abstract class Annotation {

  /** Where an immutable annotation was declared. */
  public enum Scope {
    LOCAL,
    GLOBAL
  }

  public abstract Type annotation();

  /** Declaration scope for immutable annotations; null when the annotation is mutable. */
  public abstract @Nullable Scope scope();

  /** The declared type of an immutable annotation; null when the annotation is mutable. */
  public abstract @Nullable Type original();

  public static Annotation create(Type annotation) {
    return new AutoValue_Annotation(checkNotNull(annotation), null, null);
  }

  public static Annotation createImmutable(Type annotation, Scope scope) {
    return createImmutable(annotation, scope, annotation);
  }

  public static Annotation createImmutable(Type annotation, Scope scope, Type original) {
    return new AutoValue_Annotation(
        checkNotNull(annotation), checkNotNull(scope), checkNotNull(original));
  }

  public final boolean isImmutable() {
    return scope() != null;
  }

  /** Returns an annotation with the same mutability but a different current type. */
  public final Annotation withAnnotation(Type annotation) {
    return new AutoValue_Annotation(checkNotNull(annotation), scope(), original());
  }

  @Override
  public final String toString() {
    if (!isImmutable()) {
      return "m(" + annotation() + ")";
    }
    String prefix = scope() == Scope.LOCAL ? "l" : "g";
    return prefix + "(" + annotation() + ", " + original() + ")";
  }
}
