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
package dev.mars.cowdb;

import dev.mars.cowdb.storage.ClosedException;
import dev.mars.cowdb.storage.FileStorage;
import dev.mars.cowdb.storage.StorageConfig;
import dev.mars.cowdb.tree.Codec;
import dev.mars.cowdb.tree.Codecs;
import dev.mars.cowdb.tree.KeyNotFoundException;
import dev.mars.cowdb.tree.LogicalTree;
import dev.mars.cowdb.tree.PersistentTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Objects;

/**
 * A session on a single-file cowdb store.
 * <p>
 * Changes made with {@link #set} and {@link #delete} are private to this
 * session until {@link #commit()} publishes them. {@link #close()} releases the
 * file and its write lock and discards anything not committed.
 *
 * <pre>
 * try (CowDb&lt;String, String&gt; db = CowDb.connect(Path.of("example.cowdb"))) {
 *     db.set("a", "1");
 *     db.commit();
 *     String a = db.get("a");
 * }
 * </pre>
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class CowDb<K, V> implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(CowDb.class);

    private final FileStorage storage;
    private final LogicalTree<K, V> tree;

    private CowDb(FileStorage storage, LogicalTree<K, V> tree) {
        this.storage = storage;
        this.tree = tree;
    }

    /**
     * Opens or creates a string-keyed store with configuration loaded from
     * system properties, environment variables, properties file, or defaults.
     */
    public static CowDb<String, String> connect(Path path) {
        return connect(path, StorageConfig.load());
    }

    /**
     * Opens or creates a string-keyed store. Keys are ordered naturally.
     */
    public static CowDb<String, String> connect(Path path, StorageConfig config) {
        return open(path, config, Codecs.UTF8, Comparator.naturalOrder(), Codecs.UTF8);
    }

    /**
     * Opens or creates a store with custom key and value types.
     * <p>
     * The codecs and comparator must be the same every time the file is opened.
     */
    public static <K, V> CowDb<K, V> open(Path path, StorageConfig config,
                                          Codec<K> keyCodec, Comparator<? super K> comparator,
                                          Codec<V> valueCodec) {
        FileStorage storage = FileStorage.open(path, config);
        PersistentTree<K, V> tree = new PersistentTree<>(storage, keyCodec, comparator, valueCodec);
        LOG.debug("Session opened on {} with {}", path, config);
        return new CowDb<>(storage, new LogicalTree<>(storage, tree, config.releaseLockOnCommit()));
    }

    /**
     * @throws KeyNotFoundException if the key is not present
     */
    public V get(K key) {
        assertNotClosed();
        return tree.get(Objects.requireNonNull(key, "key"));
    }

    public void set(K key, V value) {
        assertNotClosed();
        tree.set(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    }

    /**
     * @throws KeyNotFoundException if the key is not present
     */
    public void delete(K key) {
        assertNotClosed();
        tree.delete(Objects.requireNonNull(key, "key"));
    }

    public boolean contains(K key) {
        assertNotClosed();
        return tree.contains(Objects.requireNonNull(key, "key"));
    }

    /** Number of keys in the version this session currently sees. */
    public long size() {
        assertNotClosed();
        return tree.size();
    }

    /**
     * Makes this session's changes durable and visible to other sessions.
     */
    public void commit() {
        assertNotClosed();
        tree.commit();
    }

    /** The coordinator behind this session, for snapshot reads. */
    public LogicalTree<K, V> tree() {
        return tree;
    }

    public Path path() {
        return storage.path();
    }

    public boolean isClosed() {
        return storage.isClosed();
    }

    /**
     * Closes the file, releasing the write lock. Uncommitted changes are lost.
     */
    @Override
    public void close() {
        if (tree.state() == LogicalTree.State.MUTATED && !storage.isClosed()) {
            LOG.warn("Closing {} with uncommitted changes, they are discarded", storage.path());
        }
        storage.close();
    }

    private void assertNotClosed() {
        if (storage.isClosed()) {
            throw new ClosedException("Database is closed: " + storage.path());
        }
    }
}
