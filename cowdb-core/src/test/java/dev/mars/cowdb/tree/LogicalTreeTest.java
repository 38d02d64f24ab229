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

import dev.mars.cowdb.storage.FileStorage;
import dev.mars.cowdb.storage.LockException;
import dev.mars.cowdb.storage.StorageConfig;
import dev.mars.cowdb.storage.StorageException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link LogicalTree}: session state, write lock and commit.
 * <p>
 * Two sessions on one file stand in for two processes. Inside one JVM the
 * second session's lock attempt fails the same way it would across processes.
 */
class LogicalTreeTest {

    @TempDir
    Path tempDir;

    private final List<RecordingStorage> opened = new ArrayList<>();

    @AfterEach
    void tearDown() {
        opened.forEach(RecordingStorage::close);
    }

    private Session session(boolean releaseLockOnCommit) {
        StorageConfig config = StorageConfig.builder()
                .syncEnabled(false)
                .lockTimeoutMs(200)
                .releaseLockOnCommit(releaseLockOnCommit)
                .build();
        RecordingStorage storage = new RecordingStorage(
                FileStorage.open(tempDir.resolve("logical.cowdb"), config));
        opened.add(storage);
        PersistentTree<String, String> tree =
                new PersistentTree<>(storage, Codecs.UTF8, Comparator.naturalOrder(), Codecs.UTF8);
        return new Session(storage, new LogicalTree<>(storage, tree, releaseLockOnCommit));
    }

    private Session session() {
        return session(true);
    }

    private static final class Session {
        final RecordingStorage storage;
        final LogicalTree<String, String> tree;

        Session(RecordingStorage storage, LogicalTree<String, String> tree) {
            this.storage = storage;
            this.tree = tree;
        }
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    @Nested
    @DisplayName("State")
    class StateTransitions {

        @Test
        @DisplayName("Unattached, then attached, mutated and committed")
        void transitions() {
            Session s = session();
            assertEquals(LogicalTree.State.UNATTACHED, s.tree.state());

            assertEquals(0, s.tree.size());
            assertEquals(LogicalTree.State.ATTACHED, s.tree.state());

            s.tree.set("a", "1");
            assertEquals(LogicalTree.State.MUTATED, s.tree.state());

            s.tree.commit();
            assertEquals(LogicalTree.State.COMMITTED, s.tree.state());
        }

        @Test
        @DisplayName("Reads on a fresh file see an empty tree")
        void freshFile() {
            Session s = session();

            assertThrows(KeyNotFoundException.class, () -> s.tree.get("x"));
            assertFalse(s.tree.contains("x"));
            assertTrue(s.tree.snapshot().isAbsent());
        }

        @Test
        @DisplayName("Reads see this session's uncommitted changes")
        void readYourWrites() {
            Session s = session();

            s.tree.set("a", "1");
            s.tree.set("b", "2");
            s.tree.delete("a");

            assertEquals("2", s.tree.get("b"));
            assertFalse(s.tree.contains("a"));
            assertEquals(1, s.tree.size());
        }

        @Test
        @DisplayName("Deleting a missing key fails and leaves the session unchanged")
        void deleteMissing() {
            Session s = session();
            s.tree.set("a", "1");

            assertThrows(KeyNotFoundException.class, () -> s.tree.delete("b"));
            assertEquals("1", s.tree.get("a"));
        }
    }

    // ========================================================================
    // Write lock
    // ========================================================================

    @Nested
    @DisplayName("Write lock")
    class WriteLock {

        @Test
        @DisplayName("Reads do not take the lock")
        void readsAreLockFree() {
            Session s = session();

            s.tree.size();
            s.tree.contains("a");

            assertFalse(s.storage.isLocked());
        }

        @Test
        @DisplayName("First write takes the lock and commit releases it")
        void releasedOnCommit() {
            Session s = session();

            s.tree.set("a", "1");
            assertTrue(s.storage.isLocked());

            s.tree.commit();
            assertFalse(s.storage.isLocked());
        }

        @Test
        @DisplayName("A second writer times out while the first holds uncommitted changes")
        void secondWriterBlocked() {
            Session first = session();
            Session second = session();
            first.tree.set("a", "1");

            assertThrows(LockException.class, () -> second.tree.set("b", "2"));

            first.tree.commit();
            second.tree.set("b", "2");
            second.tree.commit();
            assertEquals("1", second.tree.get("a"));
            assertEquals("2", first.tree.get("b"));
        }

        @Test
        @DisplayName("With the lock kept after commit, other writers stay out until close")
        void keptAfterCommit() {
            Session first = session(false);
            Session second = session(false);

            first.tree.set("a", "1");
            first.tree.commit();
            first.tree.set("b", "2");
            first.tree.commit();

            assertTrue(first.storage.isLocked());
            assertThrows(LockException.class, () -> second.tree.set("c", "3"));

            first.storage.close();
            second.tree.set("c", "3");
            second.tree.commit();
            assertEquals(3, second.tree.size());
        }
    }

    // ========================================================================
    // Commit
    // ========================================================================

    @Nested
    @DisplayName("Commit")
    class Commit {

        @Test
        @DisplayName("Commit without changes writes nothing")
        void noChanges() {
            Session s = session();
            s.tree.size();

            s.tree.commit();

            assertEquals(0, s.storage.writes());
            assertTrue(s.storage.getRootAddress().isEmpty());
        }

        @Test
        @DisplayName("Committed changes are visible to another session")
        void visibleAfterCommit() {
            Session writer = session();
            Session reader = session();

            writer.tree.set("a", "1");
            assertFalse(reader.tree.contains("a"));

            writer.tree.commit();
            assertEquals("1", reader.tree.get("a"));
        }

        @Test
        @DisplayName("Uncommitted changes of one session stay invisible to another")
        void uncommittedInvisible() {
            Session writer = session();
            Session reader = session();
            writer.tree.set("a", "1");
            writer.tree.commit();

            writer.tree.set("a", "2");
            writer.tree.set("b", "3");

            assertEquals("1", reader.tree.get("a"));
            assertFalse(reader.tree.contains("b"));
        }

        @Test
        @DisplayName("A newly acquired lock refreshes the root before the change")
        void refreshOnLock() {
            Session first = session();
            Session second = session();
            first.tree.size();
            second.tree.size();

            second.tree.set("x", "from-second");
            second.tree.commit();
            first.tree.set("y", "from-first");
            first.tree.commit();

            assertEquals("from-second", first.tree.get("x"));
            assertEquals("from-first", second.tree.get("y"));
            assertEquals(2, second.tree.size());
        }

        @Test
        @DisplayName("A snapshot keeps showing its version after later commits")
        void snapshotIsolation() {
            Session s = session();
            s.tree.set("a", "1");
            s.tree.commit();
            Ref<Node<String, String>> snapshot = s.tree.snapshot();

            s.tree.set("a", "2");
            s.tree.set("b", "3");
            s.tree.commit();

            assertEquals("1", s.tree.tree().search(snapshot, "a"));
            assertFalse(s.tree.tree().contains(snapshot, "b"));
            assertEquals("2", s.tree.get("a"));
        }

        @Test
        @DisplayName("A failed commit keeps the old version and can be retried")
        void failedCommitRetry() {
            Session writer = session();
            Session reader = session();
            writer.tree.set("a", "1");
            writer.storage.failNextCommit();

            assertThrows(StorageException.class, () -> writer.tree.commit());
            assertEquals(LogicalTree.State.MUTATED, writer.tree.state());
            assertFalse(reader.tree.contains("a"));

            writer.storage.resetWrites();
            writer.tree.commit();

            // Records were already appended by the failed attempt
            assertEquals(0, writer.storage.writes());
            assertEquals("1", reader.tree.get("a"));
        }

        @Test
        @DisplayName("Each commit appends only new records")
        void appendOnly() {
            Session s = session();
            s.tree.set("a", "1");
            s.tree.commit();
            long firstRoot = s.storage.getRootAddress().getAsLong();

            s.tree.set("b", "2");
            s.tree.commit();

            assertTrue(s.storage.getRootAddress().getAsLong() > firstRoot);
            assertEquals("1", s.tree.tree().search(s.tree.tree().rootAt(firstRoot), "a"));
        }
    }
}
