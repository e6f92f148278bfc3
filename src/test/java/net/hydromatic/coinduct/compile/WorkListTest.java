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

import static net.hydromatic.coinduct.type.Types.obligation;
import static net.hydromatic.coinduct.type.Types.path;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNull.nullValue;

import net.hydromatic.coinduct.type.Obligation;
import org.junit.jupiter.api.Test;

/** Tests for {@link WorkList}. */
public class WorkListTest {
  private static Obligation evaluate(String typeName) {
    return obligation(path(typeName), "Evaluate");
  }

  /** The most recently added obligation is removed first. */
  @Test
  void testLifo() {
    final WorkList workList = new WorkList();
    assertThat(workList.isEmpty(), is(true));
    workList.add(evaluate("A"));
    workList.add(evaluate("B"));
    workList.add(evaluate("C"));
    assertThat(workList.size(), is(3));
    assertThat(
        workList, hasToString("[C: Evaluate, B: Evaluate, A: Evaluate]"));
    assertThat(workList.poll(), is(evaluate("C")));
    assertThat(workList.poll(), is(evaluate("B")));
    assertThat(workList.poll(), is(evaluate("A")));
    assertThat(workList.poll(), nullValue());
    assertThat(workList.isEmpty(), is(true));
  }

  /** Adding an obligation that is already pending has no effect. */
  @Test
  void testDeduplicate() {
    final WorkList workList = new WorkList();
    assertThat(workList.add(evaluate("A")), is(true));
    assertThat(workList.add(evaluate("B")), is(true));
    assertThat(workList.add(evaluate("A")), is(false));
    assertThat(workList.add(obligation(path("A"), "Evaluate")), is(false));
    assertThat(workList, hasToString("[B: Evaluate, A: Evaluate]"));

    // Once removed, an obligation may be added again
    assertThat(workList.poll(), is(evaluate("B")));
    assertThat(workList.add(evaluate("B")), is(true));
    assertThat(workList.size(), is(2));
  }
}

// End WorkListTest.java
