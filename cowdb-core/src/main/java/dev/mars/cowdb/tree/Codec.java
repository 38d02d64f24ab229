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
package dev.mars.cowdb.tree;

import dev.mars.cowdb.storage.Storage;

import java.util.List;

/**
 * Binary encoding for one referent type stored behind a {@link Ref}.
 * <p>
 * Codecs are how a {@code Ref<T>} learns to turn its referent into a record
 * and back. Keys and values supplied by callers use the simple codecs in
 * {@link Codecs}; tree nodes use a codec that also stores their children.
 *
 * @param <T> the referent type
 */
public interface Codec<T> {

    /**
     * Encodes {@code value} into a record payload.
     */
    byte[] encode(T value);

    /**
     * Decodes a record payload produced by {@link #encode(Object)}.
     *
     * @throws dev.mars.cowdb.storage.CorruptionException if the payload is malformed
     */
    T decode(byte[] bytes);

    /**
     * References held by {@code value} that must be stored before it.
     * <p>
     * {@link Ref#store(Storage)} writes every unstored reference listed here
     * first, so each record is written after all the records it addresses.
     */
    default List<Ref<?>> references(T value) {
        return List.of();
    }
}
