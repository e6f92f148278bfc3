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
package net.hydromatic.coinduct.compile;

import net.hydromatic.coinduct.ast.Declaration;
import net.hydromatic.coinduct.graph.ConstraintGraph;
import net.hydromatic.coinduct.type.Obligation;
import net.hydromatic.coinduct.util.CoinductionException;

/** Called on various events while analyzing declarations. */
public interface Tracer {
  /**
   * Called when an obligation in the graph of a declaration has been
   * resolved.
   */
  void onResolve(
      Declaration declaration,
      Obligation obligation,
      PatternMatcher.Resolution resolution);

  /** Called when expansion has finished, once for each declaration. */
  void onGraph(Declaration declaration, ConstraintGraph graph);

  /**
   * Called with each declaration and its rewritten form. If the declaration
   * has no cycles, {@code rewritten} is the same object as {@code
   * declaration}.
   */
  void onRewrite(Declaration declaration, Declaration rewritten);

  /**
   * Called with the exception that aborts an invocation. Returns whether a
   * handler was found. The exception is thrown regardless.
   */
  boolean onException(CoinductionException e);
}

// End Tracer.java
