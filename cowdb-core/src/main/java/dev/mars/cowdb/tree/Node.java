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

import java.util.Objects;

/**
 * Immutable binary search tree node.
 * <p>
 * Every key under {@code left} is strictly less than {@code key} and every key
 * under {@code right} strictly greater. {@code size} counts the nodes of the
 * subtree rooted here: {@code 1 + size(left) + size(right)}.
 *
 * @param key      the key
 * @param valueRef reference to the stored value
 * @param left     left subtree, possibly absent
 * @param right    right subtree, possibly absent
 * @param size     number of nodes in this subtree
 */
public record Node<K, V>(K key, Ref<V> valueRef, Ref<Node<K, V>> left, Ref<Node<K, V>> right, long size) {

    public Node {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(valueRef, "valueRef");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        if (size < 1) {
            throw new IllegalArgumentException("Subtree size must be positive: " + size);
        }
    }

    /**
     * A node with no children.
     */
    public static <K, V> Node<K, V> leaf(K key, Ref<V> valueRef) {
        return new Node<>(key, valueRef, Ref.absent(), Ref.absent(), 1);
    }
}
