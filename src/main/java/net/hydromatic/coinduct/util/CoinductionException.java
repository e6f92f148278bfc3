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
package net.hydromatic.coinduct.util;

import static java.util.Objects.requireNonNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Fatal error while analyzing a set of declarations.
 *
 * <p>Every kind of error aborts the whole invocation; there is no partial
 * result.
 */
public class CoinductionException extends RuntimeException {
  private final Kind kind;
  private final @Nullable String declaration;
  private final @Nullable String obligation;

  public CoinductionException(
      Kind kind,
      String message,
      @Nullable String declaration,
      @Nullable String obligation) {
    super(message);
    this.kind = requireNonNull(kind);
    this.declaration = declaration;
    this.obligation = obligation;
  }

  /** Creates an exception for a Self type that is not a simple name. */
  public static CoinductionException malformedSelfType(
      String declaration, String selfType) {
    return new CoinductionException(
        Kind.MALFORMED_SELF_TYPE,
        "Self type must be a name with optional generic arguments, but was "
            + selfType,
        declaration,
        null);
  }

  /** Creates an exception for an obligation that nothing resolves. */
  public static CoinductionException unresolved(
      String declaration, String obligation) {
    return new CoinductionException(
        Kind.UNRESOLVED_OBLIGATION,
        "No pattern or declaration resolves " + obligation,
        declaration,
        obligation);
  }

  /** Creates an exception for an obligation with several resolutions. */
  public static CoinductionException ambiguous(
      String declaration, String obligation, String candidates) {
    return new CoinductionException(
        Kind.AMBIGUOUS_TARGET,
        "Obligation " + obligation + " is resolved by more than one of "
            + candidates,
        declaration,
        obligation);
  }

  /** Creates an exception for a reference to a node that does not exist. */
  public static CoinductionException graphLookupFailure(
      int nodeId, int nodeCount) {
    return new CoinductionException(
        Kind.GRAPH_LOOKUP_FAILURE,
        "Node " + nodeId + " out of range; graph has " + nodeCount + " nodes",
        null,
        null);
  }

  /**
   * Creates an exception when expansion exceeds its configured limit.
   *
   * @param limit Maximum number of iterations
   * @param declaration Identity of the first declaration whose graph contains
   *     the obligation
   * @param obligation Obligation that would have exceeded the limit
   */
  public static CoinductionException iterationLimit(
      int limit, String declaration, String obligation) {
    return new CoinductionException(
        Kind.ITERATION_LIMIT_EXCEEDED,
        "Expansion did not finish within " + limit + " iterations",
        declaration,
        obligation);
  }

  public Kind kind() {
    return kind;
  }

  /** Returns the identity of the offending declaration, if known. */
  public @Nullable String declaration() {
    return declaration;
  }

  /** Returns the printed form of the offending obligation, if known. */
  public @Nullable String obligation() {
    return obligation;
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append("Error: ").append(kind);
    if (declaration != null) {
      buf.append(" in ").append(declaration);
    }
    return buf.append(": ").append(getMessage());
  }

  /** Kind of error. */
  public enum Kind {
    /** The Self type of a declaration is not a name plus arguments. */
    MALFORMED_SELF_TYPE,
    /** No pattern or declaration resolves an obligation. */
    UNRESOLVED_OBLIGATION,
    /** An obligation is resolved by more than one declaration, or by both a
     * pattern and a declaration. */
    AMBIGUOUS_TARGET,
    /** An edge or root refers to a node that does not exist. */
    GRAPH_LOOKUP_FAILURE,
    /** Expansion ran for more iterations than allowed. */
    ITERATION_LIMIT_EXCEEDED
  }
}

// End CoinductionException.java
