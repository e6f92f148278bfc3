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
package net.hydromatic.coinduct;

import static net.hydromatic.coinduct.type.Types.capability;
import static net.hydromatic.coinduct.type.Types.path;
import static net.hydromatic.coinduct.type.Types.tuple;

import net.hydromatic.coinduct.ast.Declaration;
import net.hydromatic.coinduct.type.CapabilityRef;

/** Declarations used by several tests. */
public class Fixtures {
  public static final CapabilityRef EVALUATE = capability("Evaluate");
  public static final CapabilityRef TRAIT_A_S =
      capability("TraitA", path("S"));
  public static final CapabilityRef TRAIT_B_S =
      capability("TraitB", path("S"));

  private Fixtures() {}

  /** Returns {@code impl Evaluate for Expr where Term: Evaluate}. */
  public static Declaration expr() {
    return Declaration.builder(path("Expr"), EVALUATE)
        .where(path("Term"), EVALUATE)
        .build();
  }

  /** Returns {@code impl Evaluate for Term where Expr: Evaluate}. */
  public static Declaration term() {
    return Declaration.builder(path("Term"), EVALUATE)
        .where(path("Expr"), EVALUATE)
        .build();
  }

  /** Returns {@code impl Cap for Leaf where i32: Cap}. */
  public static Declaration leaf() {
    return Declaration.builder(path("Leaf"), capability("Cap"))
        .where(path("i32"), capability("Cap"))
        .build();
  }

  /**
   * Returns {@code impl<S, T> TraitA<S> for RecA<T> where RecB<T>: TraitB<S>,
   * T: UpperHex + Default}.
   */
  public static Declaration recA() {
    return Declaration.builder(path("RecA", path("T")), TRAIT_A_S)
        .genericParam("S")
        .genericParam("T")
        .where(path("RecB", path("T")), TRAIT_B_S)
        .where(path("T"), capability("UpperHex"), capability("Default"))
        .body("{ fn get_a(&self) -> String { .. } }")
        .build();
  }

  /**
   * Returns {@code impl<S, T> TraitB<S> for RecB<T> where RecA<T>: TraitA<S>,
   * T: Display + Default}.
   */
  public static Declaration recB() {
    return Declaration.builder(path("RecB", path("T")), TRAIT_B_S)
        .genericParam("S")
        .genericParam("T")
        .where(path("RecA", path("T")), TRAIT_A_S)
        .where(path("T"), capability("Display"), capability("Default"))
        .build();
  }

  /**
   * Returns {@code impl<S> TraitA<S> for NodeA where (Unit, NodeB):
   * TraitA<S>}.
   */
  public static Declaration nodeA() {
    return Declaration.builder(path("NodeA"), TRAIT_A_S)
        .genericParam("S")
        .where(tuple(path("Unit"), path("NodeB")), TRAIT_A_S)
        .build();
  }

  /**
   * Returns {@code impl<S> TraitB<S> for NodeB where NodeA: TraitA<S>, S:
   * Display}.
   */
  public static Declaration nodeB() {
    return Declaration.builder(path("NodeB"), TRAIT_B_S)
        .genericParam("S")
        .where(path("NodeA"), TRAIT_A_S)
        .where(path("S"), capability("Display"))
        .build();
  }

  /** Returns {@code impl<S> TraitA<S> for Unit}. */
  public static Declaration unit() {
    return Declaration.builder(path("Unit"), TRAIT_A_S)
        .genericParam("S")
        .build();
  }
}

// End Fixtures.java
