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
 * Copy-on-write binary search tree over lazily loaded references.
 * <ul>
 *   <li>{@link dev.mars.cowdb.tree.Ref} - load-once, write-once reference to a node or value</li>
 *   <li>{@link dev.mars.cowdb.tree.Node} - immutable tree node</li>
 *   <li>{@link dev.mars.cowdb.tree.PersistentTree} - search, insert and delete by path copying</li>
 *   <li>{@link dev.mars.cowdb.tree.LogicalTree} - per-session root, locking and commit</li>
 * </ul>
 */
package dev.mars.cowdb.tree;
