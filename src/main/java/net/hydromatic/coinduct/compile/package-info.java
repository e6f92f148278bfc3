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

/**
 * Extraction, expansion and rewriting of constraint graphs.
 *
 * <p>An invocation runs three phases. {@link
 * net.hydromatic.coinduct.compile.Extractor} builds a graph for each
 * declaration and seeds the {@link net.hydromatic.coinduct.compile.WorkList};
 * {@link net.hydromatic.coinduct.compile.Expander} resolves pending
 * obligations, using {@link net.hydromatic.coinduct.compile.PatternMatcher},
 * until the work list is empty; {@link
 * net.hydromatic.coinduct.compile.CycleBreaker} rewrites each declaration
 * from its graph.
 */
package net.hydromatic.coinduct.compile;
