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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A qualified name, possibly ending in (or interleaved with) calls: {@code a.b.c} or {@code
 * a.b(x).c()}. Qualified names are the keys of the local, global, module and class tables; two
 * accesses are equal iff their elements are.
 */
@AutoValue
public abstract class Access {

  /** Prefix of identifiers that the scope builder synthesizes for locals. */
  public static final String LOCAL_PREFIX = "$local_";

  private static final Splitter DOT_SPLITTER = Splitter.on('.');
  private static final Splitter QUALIFIER_SPLITTER = Splitter.on('?').omitEmptyStrings();

  public abstract ImmutableList<Element> elements();

  public static Access of(List<Element> elements) {
    return new AutoValue_Access(ImmutableList.copyOf(elements));
  }

  /** Parses a dotted name such as {@code "os.path.join"}. */
  public static Access create(String name) {
    ImmutableList.Builder<Element> elements = ImmutableList.builder();
    for (String identifier : DOT_SPLITTER.split(name)) {
      elements.add(Element.identifier(identifier));
    }
    return of(elements.build());
  }

  /** Like {@link #create}, but returns null if {@code name} has an empty segment. */
  public static @Nullable Access tryCreate(String name) {
    List<String> identifiers = DOT_SPLITTER.splitToList(name);
    return identifiers.contains("") ? null : create(name);
  }

  public static Access empty() {
    return of(ImmutableList.of());
  }

  public final int size() {
    return elements().size();
  }

  public final boolean isEmpty() {
    return elements().isEmpty();
  }

  /** Returns the first {@code length} elements. */
  public final Access prefix(int length) {
    checkArgument(length >= 0 && length <= size(), "Bad prefix length %s for %s", length, this);
    return of(elements().subList(0, length));
  }

  public final Access append(String identifier) {
    return of(
        ImmutableList.<Element>builder()
            .addAll(elements())
            .add(Element.identifier(identifier))
            .build());
  }

  public final Access call(List<Expression> arguments) {
    return of(
        ImmutableList.<Element>builder().addAll(elements()).add(Element.call(arguments)).build());
  }

  /** Whether the access ends in a call. */
  public final boolean isCall() {
    return !isEmpty() && elements().get(size() - 1).isCall();
  }

  /**
   * For an access ending in a call, returns the access being called, i.e. everything before the
   * final call. Returns null for non-calls and for a bare call with nothing in front of it.
   */
  public final @Nullable Access callee() {
    if (!isCall() || size() < 2) {
      return null;
    }
    return prefix(size() - 1);
  }

  /** Arguments of the final call, or null if the access does not end in a call. */
  public final @Nullable ImmutableList<Expression> callArguments() {
    return isCall() ? elements().get(size() - 1).arguments() : null;
  }

  /**
   * Recovers the name a global table uses for a synthesized local. The scope builder renames
   * {@code c} declared in {@code a.b} to {@code $local_a?b$c}; this maps it back to {@code a.b.c}.
   * Other accesses are returned unchanged, apart from call arguments, which are delocalized too.
   */
  public final Access delocalize() {
    List<Element> result = new ArrayList<>();
    for (int i = 0; i < size(); i++) {
      Element element = elements().get(i);
      if (element.isCall()) {
        List<Expression> arguments = new ArrayList<>();
        for (Expression argument : element.arguments()) {
          arguments.add(argument.delocalize());
        }
        result.add(Element.call(arguments));
      } else if (i == 0 && element.identifier().startsWith(LOCAL_PREFIX)) {
        result.addAll(delocalizeIdentifier(element.identifier()));
      } else {
        result.add(element);
      }
    }
    return of(result);
  }

  /** Identifiers that are not of the form {@code $local_<qualifier>$<name>} are kept as is. */
  private static List<Element> delocalizeIdentifier(String identifier) {
    String stripped = identifier.substring(LOCAL_PREFIX.length());
    int separator = stripped.lastIndexOf('$');
    if (separator <= 0 || separator == stripped.length() - 1) {
      return ImmutableList.of(Element.identifier(identifier));
    }
    List<String> qualifiers = QUALIFIER_SPLITTER.splitToList(stripped.substring(0, separator));
    if (qualifiers.isEmpty()) {
      return ImmutableList.of(Element.identifier(identifier));
    }
    List<Element> result = new ArrayList<>();
    for (String qualifier : qualifiers) {
      result.add(Element.identifier(qualifier));
    }
    result.add(Element.identifier(stripped.substring(separator + 1)));
    return result;
  }

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    for (Element element : elements()) {
      if (element.isCall()) {
        sb.append('(').append(Joiner.on(", ").join(element.arguments())).append(')');
      } else {
        if (sb.length() > 0) {
          sb.append('.');
        }
        sb.append(element.identifier());
      }
    }
    return sb.toString();
  }

  /** One step of an access: an identifier or a call. */
  @AutoValue
  public abstract static class Element {
    /** The identifier, or null for a call. */
    abstract @Nullable String maybeIdentifier();

    /** The call arguments, or null for an identifier. */
    abstract @Nullable ImmutableList<Expression> maybeArguments();

    public static Element identifier(String identifier) {
      checkArgument(!identifier.isEmpty(), "Empty identifier");
      return new AutoValue_Access_Element(identifier, null);
    }

    public static Element call(List<Expression> arguments) {
      return new AutoValue_Access_Element(null, ImmutableList.copyOf(arguments));
    }

    public final boolean isCall() {
      return maybeArguments() != null;
    }

    public final String identifier() {
      String identifier = maybeIdentifier();
      checkArgument(identifier != null, "Call element has no identifier");
      return identifier;
    }

    public final ImmutableList<Expression> arguments() {
      ImmutableList<Expression> arguments = maybeArguments();
      checkArgument(arguments != null, "Identifier element has no arguments");
      return arguments;
    }

    @Override
    public final String toString() {
      return isCall() ? "(" + Joiner.on(", ").join(maybeArguments()) + ")" : identifier();
    }
  }
}
