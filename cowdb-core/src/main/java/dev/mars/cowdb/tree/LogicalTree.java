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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Session-level view of the tree in one {@link Storage}.
 * <p>
 * Holds the session's current root reference and binds the
 * {@link PersistentTree} algorithms to the storage's lock and root pointer:
 * <ul>
 *   <li><b>Reads</b> without the write lock refresh the root from the header
 *       first, so they see the latest committed version.</li>
 *   <li><b>Writes</b> take the write lock. When the lock is newly acquired the
 *       root is refreshed before the change is applied, because another writer
 *       may have committed in between.</li>
 *   <li><b>Commit</b> stores the root reference (which stores every unstored
 *       node under it, children first) and then publishes its address.</li>
 * </ul>
 * With {@code releaseLockOnCommit} the lock is released after each successful
 * commit. Otherwise it is kept until the storage is closed, so several commits
 * can form one batch no other writer can interleave with.
 * <p>
 * Not thread-safe. Readers on other threads can hold a {@link #snapshot()}
 * and query it through {@link #tree()} without any locking.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class LogicalTree<K, V> {

    private static final Logger LOG = LoggerFactory.getLogger(LogicalTree.class);

    /** Lifecycle of the session's root reference. */
    public enum State {
        /** No root resolved yet. */
        UNATTACHED,
        /** Root reflects what the header held at the last refresh. */
        ATTACHED,
        /** Root changed in memory and not yet committed. */
        MUTATED,
        /** Root was published by this session's last commit. */
        COMMITTED
    }

    private final Storage storage;
    private final PersistentTree<K, V> tree;
    private final boolean releaseLockOnCommit;

    private Ref<Node<K, V>> root;
    private State state = State.UNATTACHED;

    public LogicalTree(Storage storage, PersistentTree<K, V> tree, boolean releaseLockOnCommit) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.tree = Objects.requireNonNull(tree, "tree");
        this.releaseLockOnCommit = releaseLockOnCommit;
    }

    // ========================================================================
    // Reads
    // ========================================================================

    /**
     * @throws KeyNotFoundException if the key is not present
     */
    public V get(K key) {
        refreshIfUnlocked();
        return tree.search(root, key);
    }

    public boolean contains(K key) {
        refreshIfUnlocked();
        return tree.contains(root, key);
    }

    public long size() {
        refreshIfUnlocked();
        return tree.size(root);
    }

    /**
     * The current root reference.
     * <p>
     * Nodes reachable from it are never modified, so it stays a consistent
     * view of this version for as long as the caller keeps it.
     */
    public Ref<Node<K, V>> snapshot() {
        refreshIfUnlocked();
        return root;
    }

    // ========================================================================
    // Writes
    // ========================================================================

    public void set(K key, V value) {
        beginWrite();
        root = tree.insert(root, key, tree.valueRef(value));
        state = State.MUTATED;
    }

    /**
     * @throws KeyNotFoundException if the key is not present
     */
    public void delete(K key) {
        beginWrite();
        root = tree.delete(root, key);
        state = State.MUTATED;
    }

    /**
     * Stores all uncommitted nodes and publishes the new root.
     * <p>
     * Without the write lock this session has nothing to publish and the call
     * is a no-op. If storing or publishing fails, the previously committed
     * version stays visible and the call can be retried.
     */
    public void commit() {
        if (!storage.isLocked()) {
            LOG.debug("commit() without the write lock, nothing to publish");
            return;
        }
        if (root == null) {
            refresh();
        }

        long address = root.store(storage);
        storage.commitRootAddress(address);
        state = State.COMMITTED;
        LOG.info("Commit published: rootAddress={}, size={}", address, tree.size(root));

        if (releaseLockOnCommit) {
            storage.unlock();
        }
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public State state() {
        return state;
    }

    public PersistentTree<K, V> tree() {
        return tree;
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private void beginWrite() {
        if (storage.lock() || root == null) {
            refresh();
        }
    }

    private void refreshIfUnlocked() {
        if (!storage.isLocked() || root == null) {
            refresh();
        }
    }

    private void refresh() {
        long address = storage.getRootAddress().orElse(Storage.NO_ADDRESS);
        if (root != null && root.address() == address && (root.isStored() || root.isAbsent())) {
            // Same version, keep the cached nodes
            return;
        }
        LOG.debug("Root refreshed: address={}", address);
        root = tree.rootAt(address);
        state = State.ATTACHED;
    }
}
