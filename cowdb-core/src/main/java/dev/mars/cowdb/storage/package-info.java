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
 * Storage layer: append-only records plus an atomically updated root pointer.
 * <ul>
 *   <li>{@link dev.mars.cowdb.storage.Storage} - The storage interface</li>
 *   <li>{@link dev.mars.cowdb.storage.FileStorage} - Single-file implementation</li>
 *   <li>{@link dev.mars.cowdb.storage.StorageConfig} - Configuration resolution</li>
 * </ul>
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * example.cowdb
 *  ├─ header   MAGIC | VERSION | reserved | ROOT_ADDRESS   (16 bytes, root updated in place)
 *  └─ records  [LENGTH][PAYLOAD] ...                       (append-only)
 * </pre>
 *
 * @see dev.mars.cowdb.storage.Storage
 */
package dev.mars.cowdb.storage;
