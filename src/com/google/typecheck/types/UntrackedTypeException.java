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

/**
 * Thrown by a {@link TypeOrder} when it is asked about a type whose name it does not track.
 * Callers of the lattice that can recover are expected to catch this close to where they queried.
 */
public final class UntrackedTypeException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final transient Type type;

  public UntrackedTypeException(Type type) {
    super("Type not tracked by the order: " + type);
    this.type = type;
  }

  /** The type the order was asked about. */
  public Type getType() {
    return type;
  }
}
