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
 * Walking syntax trees.
 *
 * <h2>Key Classes</h2>
 *
 * <ul>
 *   <li>{@link net.hydromatic.treewalk.walk.Walker} - Visits each node of a
 *       tree, calling the visitors of a
 *       {@link net.hydromatic.treewalk.walk.WalkConfig} on the way down and up.
 *       A down-visitor returns a {@link net.hydromatic.treewalk.walk.Visit},
 *       which may replace the node or cut off its children.
 *   <li>{@link net.hydromatic.treewalk.walk.ScopedWalker} - Walker that also
 *       reports whether each identifier is bound, and by which node.
 *   <li>{@link net.hydromatic.treewalk.walk.AlphaRenamer} - Gives each bound
 *       variable a name that is unique within the tree.
 * </ul>
 */
package net.hydromatic.treewalk.walk;

// End package-info.java
