/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
/**
 * Embedded single-file key-value store built on a copy-on-write binary search tree.
 * <p>
 * {@link dev.mars.cowdb.CowDb} is the entry point. It wraps:
 * <ul>
 *   <li>{@link dev.mars.cowdb.storage} - append-only file storage with a root pointer header</li>
 *   <li>{@link dev.mars.cowdb.tree} - lazy references, the persistent tree and the session coordinator</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Copy-on-write:</b> a change rebuilds only the path to it; stored nodes are never rewritten</li>
 *   <li><b>Single publication point:</b> a version becomes visible when the root pointer is updated, after all of its records are durable</li>
 *   <li><b>Single writer:</b> writers serialize on an exclusive file lock; readers never lock</li>
 * </ul>
 */
package dev.mars.cowdb;
