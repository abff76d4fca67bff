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

import com.google.typecheck.ast.Access;
import com.google.typecheck.ast.Expression;
import com.google.typecheck.ast.ModuleDefinition;
import com.google.typecheck.types.Type;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/** Applies the tracking policy on top of the injected raw annotation parser. */
final class AnnotationParser {
  private static final Logger logger = Logger.getLogger(AnnotationParser.class.getName());

  private final Resolution resolution;

  AnnotationParser(Resolution resolution) {
    this.resolution = resolution;
  }

  Type parse(Expression expression, boolean allowUntracked) {
    if (expression.toString().contains(Access.LOCAL_PREFIX)) {
      expression = expression.delocalize();
    }
    Type annotation =
        resolution.annotationParser().parse(expression).instantiate(this::fromEmptyStub);
    if (!allowUntracked && resolution.containsUntracked(annotation)) {
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("Annotation " + expression + " mentions untracked types: " + annotation);
      }
      return Type.TOP;
    }
    return annotation;
  }

  /** Nothing is known about names in an empty stub, so they accept anything. */
  private @Nullable Type fromEmptyStub(Type type) {
    Type.Primitive primitive = type.toMaybePrimitive();
    if (primitive == null) {
      return null;
    }
    Access name = Access.tryCreate(primitive.name());
    if (name != null && ModuleDefinition.fromEmptyStub(name, resolution::moduleDefinition)) {
      return Type.OBJECT;
    }
    return null;
  }
}
