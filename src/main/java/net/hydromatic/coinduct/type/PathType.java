/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.coinduct.type;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.UnaryOperator;
import net.hydromatic.coinduct.util.Static;

/**
 * Type that is a path, optionally with generic arguments.
 *
 * <p>For example, {@code Expr}, {@code Vec<Term>}, {@code i32} and {@code
 * core::marker::PhantomData<T>}. A generic parameter such as {@code T} is a
 * path of one segment with no arguments.
 */
public class PathType extends BaseType {
  private static final Joiner PATH_JOINER = Joiner.on("::");

  /** Segments of the path; for {@code a::b::C}, [a, b, C]. Never empty. */
  public final ImmutableList<String> segments;
  public final ImmutableList<TypeExpr> args;

  PathType(List<String> segments, List<? extends TypeExpr> args) {
    super(
        Kind.PATH,
        describe(new StringBuilder(), checkSegments(segments), args)
            .toString());
    this.segments = ImmutableList.copyOf(segments);
    this.args = ImmutableList.copyOf(args);
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    return describe(buf, segments, args);
  }

  /** Returns the full name, e.g. "{@code core::marker::PhantomData}". */
  public String name() {
    return PATH_JOINER.join(segments);
  }

  /** Returns whether the path has more than one segment. */
  public boolean isQualified() {
    return segments.size() > 1;
  }

  /** Returns whether this is a bare name, with one segment and no arguments. */
  public boolean isBareName() {
    return segments.size() == 1 && args.isEmpty();
  }

  @Override
  public ImmutableList<TypeExpr> args() {
    return args;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public PathType copy(UnaryOperator<TypeExpr> transform) {
    final ImmutableList<TypeExpr> args2 =
        Static.transformEager(args, transform::apply);
    if (Static.elementsIdentical(args, args2)) {
      return this;
    }
    return new PathType(segments, args2);
  }

  static StringBuilder describe(
      StringBuilder buf, List<String> segments, List<? extends TypeExpr> args) {
    PATH_JOINER.appendTo(buf, segments);
    if (!args.isEmpty()) {
      buf.append('<');
      for (int i = 0; i < args.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        args.get(i).describe(buf);
      }
      buf.append('>');
    }
    return buf;
  }

  static List<String> checkSegments(List<String> segments) {
    checkArgument(!segments.isEmpty(), "path has no segments");
    for (String segment : segments) {
      checkArgument(!segment.isEmpty(), "empty segment in path %s", segments);
      checkArgument(
          segment.charAt(0) != '$',
          "segment '%s' in path %s must not start with '$'",
          segment,
          segments);
    }
    return segments;
  }
}

// End PathType.java
