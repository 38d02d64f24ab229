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

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.Objects;

/**
 * Copy-on-write binary search tree algorithms over node references.
 * <p>
 * No method here mutates a {@link Node}. An insert or delete rebuilds only the
 * nodes on the path from the root to the change, each under a new unstored
 * {@link Ref}, and returns the new root reference. Every subtree off that
 * path keeps its original reference object, and with it its address, so an
 * older root keeps seeing exactly the tree it saw before.
 * <p>
 * Nodes are loaded from {@link Storage} on demand while descending. Nothing is
 * written here; writing happens when the caller stores the returned root.
 * <p>
 * The tree is not rebalanced, so sorted input degenerates into a chain as deep
 * as the tree is large. Every algorithm here walks the tree with loops and an
 * explicit path, never by recursion.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class PersistentTree<K, V> {

    private final Storage storage;
    private final Comparator<? super K> comparator;
    private final Codec<V> valueCodec;
    private final NodeCodec<K, V> nodeCodec;

    /**
     * @param storage    storage the references resolve against
     * @param keyCodec   encoding of keys inside node records
     * @param comparator total order on keys
     * @param valueCodec encoding of values
     */
    public PersistentTree(Storage storage, Codec<K> keyCodec, Comparator<? super K> comparator, Codec<V> valueCodec) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.comparator = Objects.requireNonNull(comparator, "comparator");
        this.valueCodec = new ValueCodec<>(Objects.requireNonNull(valueCodec, "valueCodec"));
        this.nodeCodec = new NodeCodec<>(Objects.requireNonNull(keyCodec, "keyCodec"), this.valueCodec);
    }

    /**
     * A root reference for the node record at {@code address}, or the empty
     * tree for {@link Storage#NO_ADDRESS}.
     */
    public Ref<Node<K, V>> rootAt(long address) {
        return Ref.at(address, nodeCodec);
    }

    /**
     * A new unstored reference to {@code value}, ready for {@link #insert}.
     */
    public Ref<V> valueRef(V value) {
        return Ref.of(value, valueCodec);
    }

    // ========================================================================
    // Queries
    // ========================================================================

    /**
     * Looks up {@code key}.
     *
     * @throws KeyNotFoundException if the tree does not contain the key
     */
    public V search(Ref<Node<K, V>> root, K key) {
        Node<K, V> node = find(root, key);
        if (node == null) {
            throw new KeyNotFoundException(key);
        }
        return node.valueRef().get(storage);
    }

    /**
     * Whether the tree contains {@code key}. Does not load the value.
     */
    public boolean contains(Ref<Node<K, V>> root, K key) {
        return find(root, key) != null;
    }

    /**
     * Number of keys in the tree.
     */
    public long size(Ref<Node<K, V>> root) {
        return sizeOf(root);
    }

    /**
     * Loads the node a reference points to, or null if absent.
     */
    public Node<K, V> node(Ref<Node<K, V>> ref) {
        return ref.get(storage);
    }

    private Node<K, V> find(Ref<Node<K, V>> root, K key) {
        Objects.requireNonNull(key, "key");
        Ref<Node<K, V>> current = root;
        while (true) {
            Node<K, V> node = current.get(storage);
            if (node == null) {
                return null;
            }
            int cmp = comparator.compare(key, node.key());
            if (cmp < 0) {
                current = node.left();
            } else if (cmp > 0) {
                current = node.right();
            } else {
                return node;
            }
        }
    }

    // ========================================================================
    // Updates
    // ========================================================================

    /**
     * Returns a new root with {@code key} bound to {@code valueRef}.
     * <p>
     * An existing key keeps its node position and children; only its value
     * reference changes.
     */
    public Ref<Node<K, V>> insert(Ref<Node<K, V>> root, K key, Ref<V> valueRef) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(valueRef, "valueRef");

        Deque<Step<K, V>> path = new ArrayDeque<>();
        Ref<Node<K, V>> current = root;
        while (true) {
            Node<K, V> node = current.get(storage);
            if (node == null) {
                return copyPath(path, Ref.of(Node.leaf(key, valueRef), nodeCodec));
            }
            int cmp = comparator.compare(key, node.key());
            if (cmp == 0) {
                // Same children, same size
                Node<K, V> replaced = new Node<>(node.key(), valueRef, node.left(), node.right(), node.size());
                return copyPath(path, Ref.of(replaced, nodeCodec));
            }
            path.push(new Step<>(node, cmp < 0));
            current = cmp < 0 ? node.left() : node.right();
        }
    }

    /**
     * Returns a new root without {@code key}.
     *
     * @throws KeyNotFoundException if the tree does not contain the key
     */
    public Ref<Node<K, V>> delete(Ref<Node<K, V>> root, K key) {
        Objects.requireNonNull(key, "key");

        Deque<Step<K, V>> path = new ArrayDeque<>();
        Ref<Node<K, V>> current = root;
        Node<K, V> node;
        while (true) {
            node = current.get(storage);
            if (node == null) {
                throw new KeyNotFoundException(key);
            }
            int cmp = comparator.compare(key, node.key());
            if (cmp == 0) {
                break;
            }
            path.push(new Step<>(node, cmp < 0));
            current = cmp < 0 ? node.left() : node.right();
        }

        if (node.left().isAbsent()) {
            return copyPath(path, node.right());
        }
        if (node.right().isAbsent()) {
            return copyPath(path, node.left());
        }

        // Two children: the in-order successor takes this node's place
        Node<K, V> successor = findMin(node.right()).get(storage);
        return copyPath(path,
                rebuild(successor.key(), successor.valueRef(), node.left(), deleteMin(node.right())));
    }

    /**
     * Reference to the node with the smallest key in a non-empty subtree.
     */
    Ref<Node<K, V>> findMin(Ref<Node<K, V>> ref) {
        Ref<Node<K, V>> current = ref;
        while (true) {
            Node<K, V> node = current.get(storage);
            if (node.left().isAbsent()) {
                return current;
            }
            current = node.left();
        }
    }

    /**
     * New root of a non-empty subtree with its smallest key removed.
     */
    Ref<Node<K, V>> deleteMin(Ref<Node<K, V>> ref) {
        Deque<Step<K, V>> path = new ArrayDeque<>();
        Node<K, V> node = ref.get(storage);
        while (!node.left().isAbsent()) {
            path.push(new Step<>(node, true));
            node = node.left().get(storage);
        }
        return copyPath(path, node.right());
    }

    /**
     * Rebuilds the descent recorded in {@code path} bottom-up around
     * {@code replacement}, the new subtree at the bottom of the path.
     */
    private Ref<Node<K, V>> copyPath(Deque<Step<K, V>> path, Ref<Node<K, V>> replacement) {
        Ref<Node<K, V>> subtree = replacement;
        while (!path.isEmpty()) {
            Step<K, V> step = path.pop();
            Node<K, V> parent = step.node();
            subtree = step.wentLeft()
                    ? rebuild(parent.key(), parent.valueRef(), subtree, parent.right())
                    : rebuild(parent.key(), parent.valueRef(), parent.left(), subtree);
        }
        return subtree;
    }

    private Ref<Node<K, V>> rebuild(K key, Ref<V> valueRef, Ref<Node<K, V>> left, Ref<Node<K, V>> right) {
        long size = 1 + sizeOf(left) + sizeOf(right);
        return Ref.of(new Node<>(key, valueRef, left, right, size), nodeCodec);
    }

    private long sizeOf(Ref<Node<K, V>> ref) {
        Node<K, V> node = ref.get(storage);
        return node == null ? 0 : node.size();
    }

    /** One level of a descent: the node passed and the side taken. */
    private record Step<K, V>(Node<K, V> node, boolean wentLeft) {
    }
}
