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
import dev.mars.cowdb.storage.StorageConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the immutable tree algorithms in {@link PersistentTree}.
 */
class PersistentTreeTest {

    @TempDir
    Path tempDir;

    private FileStorage file;
    private RecordingStorage storage;
    private PersistentTree<Long, String> tree;

    @BeforeEach
    void setUp() {
        file = FileStorage.open(tempDir.resolve("tree.cowdb"),
                StorageConfig.builder().syncEnabled(false).build());
        storage = new RecordingStorage(file);
        tree = new PersistentTree<>(storage, Codecs.LONG, Comparator.naturalOrder(), Codecs.UTF8);
    }

    @AfterEach
    void tearDown() {
        storage.close();
    }

    private Ref<Node<Long, String>> build(long... keys) {
        Ref<Node<Long, String>> root = Ref.absent();
        for (long key : keys) {
            root = tree.insert(root, key, tree.valueRef("v" + key));
        }
        return root;
    }

    private List<Long> keysInOrder(Ref<Node<Long, String>> ref) {
        List<Long> keys = new ArrayList<>();
        Deque<Node<Long, String>> stack = new ArrayDeque<>();
        Node<Long, String> node = tree.node(ref);
        while (node != null || !stack.isEmpty()) {
            while (node != null) {
                stack.push(node);
                node = tree.node(node.left());
            }
            node = stack.pop();
            keys.add(node.key());
            node = tree.node(node.right());
        }
        return keys;
    }

    /** Checks every stored size against its children and returns the tree size. */
    private long checkSizes(Ref<Node<Long, String>> ref) {
        Deque<Node<Long, String>> stack = new ArrayDeque<>();
        Node<Long, String> root = tree.node(ref);
        if (root != null) {
            stack.push(root);
        }
        while (!stack.isEmpty()) {
            Node<Long, String> node = stack.pop();
            Node<Long, String> left = tree.node(node.left());
            Node<Long, String> right = tree.node(node.right());
            long expected = 1 + (left == null ? 0 : left.size()) + (right == null ? 0 : right.size());
            assertEquals(expected, node.size(), () -> "size of node " + node.key());
            if (left != null) {
                stack.push(left);
            }
            if (right != null) {
                stack.push(right);
            }
        }
        return tree.size(ref);
    }

    private static List<Long> range(long fromInclusive, long toExclusive) {
        List<Long> keys = new ArrayList<>();
        for (long key = fromInclusive; key < toExclusive; key++) {
            keys.add(key);
        }
        return keys;
    }

    // ========================================================================
    // Empty tree
    // ========================================================================

    @Nested
    @DisplayName("Empty tree")
    class Empty {

        @Test
        @DisplayName("Search fails with the missing key")
        void searchFails() {
            KeyNotFoundException e = assertThrows(KeyNotFoundException.class,
                    () -> tree.search(Ref.absent(), 7L));
            assertEquals(7L, e.key());
        }

        @Test
        @DisplayName("Delete fails, contains is false and size is zero")
        void deleteFails() {
            assertThrows(KeyNotFoundException.class, () -> tree.delete(Ref.absent(), 7L));
            assertFalse(tree.contains(Ref.absent(), 7L));
            assertEquals(0, tree.size(Ref.absent()));
        }

        @Test
        @DisplayName("First insert yields an unstored leaf")
        void firstInsert() {
            Ref<Node<Long, String>> root = build(1L);

            assertEquals(Ref.State.UNSTORED, root.state());
            Node<Long, String> node = tree.node(root);
            assertEquals(1L, node.key());
            assertEquals(1L, node.size());
            assertTrue(node.left().isAbsent());
            assertTrue(node.right().isAbsent());
        }
    }

    // ========================================================================
    // Insert and search
    // ========================================================================

    @Nested
    @DisplayName("Insert and search")
    class InsertAndSearch {

        @Test
        @DisplayName("Every inserted key is found with its value")
        void findsEveryKey() {
            Ref<Node<Long, String>> root = build(50, 25, 75, 10, 30, 60, 90);

            for (long key : new long[]{50, 25, 75, 10, 30, 60, 90}) {
                assertEquals("v" + key, tree.search(root, key));
                assertTrue(tree.contains(root, key));
            }
            assertFalse(tree.contains(root, 11L));
            assertThrows(KeyNotFoundException.class, () -> tree.search(root, 11L));
            assertEquals(List.of(10L, 25L, 30L, 50L, 60L, 75L, 90L), keysInOrder(root));
            assertEquals(7, tree.size(root));
        }

        @Test
        @DisplayName("Overwriting a key keeps the count and the children")
        void overwrite() {
            Ref<Node<Long, String>> root = build(50, 25, 75);
            Node<Long, String> before = tree.node(root);

            Ref<Node<Long, String>> updated = tree.insert(root, 50L, tree.valueRef("new"));
            Node<Long, String> after = tree.node(updated);

            assertEquals("new", tree.search(updated, 50L));
            assertEquals(3, tree.size(updated));
            assertSame(before.left(), after.left());
            assertSame(before.right(), after.right());
        }

        @Test
        @DisplayName("The previous root is untouched by an insert")
        void previousVersionUnchanged() {
            Ref<Node<Long, String>> v1 = build(50, 25, 75);
            Ref<Node<Long, String>> v2 = tree.insert(v1, 60L, tree.valueRef("v60"));
            Ref<Node<Long, String>> v3 = tree.insert(v2, 50L, tree.valueRef("changed"));

            assertFalse(tree.contains(v1, 60L));
            assertEquals(3, tree.size(v1));
            assertEquals("v50", tree.search(v1, 50L));
            assertEquals("v50", tree.search(v2, 50L));
            assertEquals("changed", tree.search(v3, 50L));
        }

        @Test
        @DisplayName("Inserting into a stored tree writes only the rebuilt path")
        void structuralSharing() {
            Ref<Node<Long, String>> root = build(50, 25, 75, 10, 30, 60, 90);
            long rootAddress = root.store(storage);
            Ref<Node<Long, String>> reloaded = tree.rootAt(rootAddress);
            Ref<Node<Long, String>> leftSubtree = tree.node(reloaded).left();
            long leftAddress = leftSubtree.address();
            storage.resetWrites();

            Ref<Node<Long, String>> updated = tree.insert(reloaded, 95L, tree.valueRef("v95"));
            updated.store(storage);

            // 50, 75, 90 rebuilt, 95 new, plus its value
            assertEquals(5, storage.writes());
            assertSame(leftSubtree, tree.node(updated).left());
            assertEquals(leftAddress, tree.node(updated).left().address());
        }
    }

    // ========================================================================
    // Delete
    // ========================================================================

    @Nested
    @DisplayName("Delete")
    class Delete {

        @Test
        @DisplayName("Deleting a leaf removes only that key")
        void leaf() {
            Ref<Node<Long, String>> root = build(50, 25, 75);

            Ref<Node<Long, String>> updated = tree.delete(root, 25L);

            assertEquals(List.of(50L, 75L), keysInOrder(updated));
            assertTrue(tree.node(updated).left().isAbsent());
            assertEquals(2, tree.size(updated));
        }

        @Test
        @DisplayName("Deleting a node with one child promotes the child as is")
        void oneChild() {
            Ref<Node<Long, String>> root = build(50, 25, 75, 90);
            Ref<Node<Long, String>> ninety = tree.node(tree.node(root).right()).right();

            Ref<Node<Long, String>> updated = tree.delete(root, 75L);

            assertSame(ninety, tree.node(updated).right());
            assertEquals(List.of(25L, 50L, 90L), keysInOrder(updated));
        }

        @Test
        @DisplayName("Deleting a node with two children uses the in-order successor")
        void twoChildren() {
            Ref<Node<Long, String>> root = build(50, 25, 75, 60, 90, 65);

            Ref<Node<Long, String>> updated = tree.delete(root, 50L);
            Node<Long, String> newRoot = tree.node(updated);

            assertEquals(60L, newRoot.key());
            assertEquals("v60", newRoot.valueRef().get(storage));
            assertEquals(List.of(65L, 75L, 90L), keysInOrder(newRoot.right()));
            assertEquals(5, tree.size(updated));
            checkSizes(updated);
        }

        @Test
        @DisplayName("Deleting the only key leaves the empty tree")
        void lastKey() {
            Ref<Node<Long, String>> updated = tree.delete(build(1L), 1L);

            assertTrue(updated.isAbsent());
            assertEquals(0, tree.size(updated));
        }

        @Test
        @DisplayName("Deleting a missing key fails and leaves the tree as it was")
        void missingKey() {
            Ref<Node<Long, String>> root = build(50, 25, 75);

            assertThrows(KeyNotFoundException.class, () -> tree.delete(root, 26L));
            assertEquals(List.of(25L, 50L, 75L), keysInOrder(root));
        }

        @Test
        @DisplayName("The previous root is untouched by a delete")
        void previousVersionUnchanged() {
            Ref<Node<Long, String>> v1 = build(50, 25, 75);

            Ref<Node<Long, String>> v2 = tree.delete(v1, 50L);

            assertTrue(tree.contains(v1, 50L));
            assertFalse(tree.contains(v2, 50L));
            assertEquals(3, tree.size(v1));
        }
    }

    // ========================================================================
    // Minimum helpers
    // ========================================================================

    @Nested
    @DisplayName("Minimum helpers")
    class Minimum {

        @Test
        @DisplayName("findMin returns the leftmost node")
        void findMin() {
            Ref<Node<Long, String>> root = build(50, 25, 75, 10, 30);

            assertEquals(10L, tree.node(tree.findMin(root)).key());
            assertEquals(50L, tree.node(tree.findMin(build(50, 75))).key());
        }

        @Test
        @DisplayName("deleteMin removes the leftmost node and keeps its right subtree")
        void deleteMin() {
            Ref<Node<Long, String>> root = build(50, 25, 75, 10, 15);

            Ref<Node<Long, String>> updated = tree.deleteMin(root);

            assertEquals(List.of(15L, 25L, 50L, 75L), keysInOrder(updated));
            checkSizes(updated);
        }
    }

    // ========================================================================
    // Degenerate trees
    // ========================================================================

    @Nested
    @DisplayName("Sorted input")
    class SortedInput {

        private static final int DEPTH = 20_000;

        @Test
        @DisplayName("Ascending keys build a right chain that stores, reloads and updates")
        void ascending() {
            Ref<Node<Long, String>> root = Ref.absent();
            for (long key = 0; key < DEPTH; key++) {
                root = tree.insert(root, key, tree.valueRef("v" + key));
            }

            Ref<Node<Long, String>> reloaded = tree.rootAt(root.store(storage));

            assertEquals(range(0, DEPTH), keysInOrder(reloaded));
            assertEquals(DEPTH, checkSizes(reloaded));
            assertEquals("v" + (DEPTH - 1), tree.search(reloaded, DEPTH - 1L));
            assertTrue(tree.node(tree.node(reloaded).right()).left().isAbsent());

            Ref<Node<Long, String>> updated = tree.delete(reloaded, DEPTH - 1L);
            updated = tree.insert(updated, (long) DEPTH, tree.valueRef("last"));
            updated = tree.rootAt(updated.store(storage));

            assertFalse(tree.contains(updated, DEPTH - 1L));
            assertEquals("last", tree.search(updated, (long) DEPTH));
            assertEquals(DEPTH, checkSizes(updated));
            assertEquals(DEPTH, tree.size(reloaded));
        }

        @Test
        @DisplayName("Descending keys build a left chain that deleteMin and delete handle")
        void descending() {
            Ref<Node<Long, String>> root = Ref.absent();
            for (long key = DEPTH - 1; key >= 0; key--) {
                root = tree.insert(root, key, tree.valueRef("v" + key));
            }
            root = tree.rootAt(root.store(storage));

            assertEquals(range(0, DEPTH), keysInOrder(root));
            assertEquals(DEPTH, checkSizes(root));
            assertEquals(0L, tree.node(tree.findMin(root)).key());

            Ref<Node<Long, String>> withoutMin = tree.deleteMin(root);
            assertEquals(range(1, DEPTH), keysInOrder(withoutMin));

            Ref<Node<Long, String>> withoutMiddle = tree.delete(withoutMin, DEPTH / 2L);
            assertFalse(tree.contains(withoutMiddle, DEPTH / 2L));
            assertEquals(DEPTH - 2, checkSizes(withoutMiddle));
            assertEquals(DEPTH, tree.size(root));
        }
    }

    // ========================================================================
    // Randomized
    // ========================================================================

    @Test
    @DisplayName("Random inserts and deletes agree with a sorted map across store and reload")
    void randomizedAgainstTreeMap() {
        Random random = new Random(42);
        Map<Long, String> expected = new TreeMap<>();
        Ref<Node<Long, String>> root = Ref.absent();

        for (int i = 1; i <= 2000; i++) {
            long key = random.nextInt(200);
            if (random.nextInt(3) == 0) {
                if (expected.containsKey(key)) {
                    root = tree.delete(root, key);
                    expected.remove(key);
                } else {
                    Ref<Node<Long, String>> current = root;
                    assertThrows(KeyNotFoundException.class, () -> tree.delete(current, key));
                }
            } else {
                String value = "v" + i;
                root = tree.insert(root, key, tree.valueRef(value));
                expected.put(key, value);
            }

            if (i % 250 == 0) {
                root = tree.rootAt(root.store(storage));
                assertEquals(new ArrayList<>(expected.keySet()), keysInOrder(root));
                assertEquals(expected.size(), checkSizes(root));
                for (Map.Entry<Long, String> entry : expected.entrySet()) {
                    assertEquals(entry.getValue(), tree.search(root, entry.getKey()));
                }
            }
        }
        assertEquals(expected.size(), tree.size(root));
    }
}
