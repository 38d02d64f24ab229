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
package dev.mars.cowdb.storage;

import java.io.Closeable;
import java.util.OptionalLong;

/**
 * Addressed, append-only byte storage with an atomically updatable root pointer.
 * <p>
 * Every record is written once at the end of the store and identified by its
 * address (byte offset). Nothing ever overwrites a record. The only in-place
 * update is the root pointer in the header, which is how a new tree version is
 * published.
 * <p>
 * <b>Critical Contract:</b> {@link #commitRootAddress(long)} must make every
 * record written before it durable, and only then update the header. A crash
 * at any point therefore leaves either the old root or the new root visible,
 * never a root that points at missing records.
 * <p>
 * Single-writer serialization uses {@link #lock()}/{@link #unlock()}. Readers
 * do not lock.
 *
 * @see FileStorage
 */
public interface Storage extends Closeable {

    /** Address value meaning "no record" (empty tree, empty child slot). */
    long NO_ADDRESS = 0L;

    // ========================================================================
    // Records
    // ========================================================================

    /**
     * Appends a length-prefixed record at the end of the store.
     * <p>
     * NOT required to be durable on return. Use {@link #flush()} or
     * {@link #commitRootAddress(long)} for that.
     *
     * @param payload the record payload
     * @return the address of the new record
     * @throws ClosedException if the storage is closed
     */
    long write(byte[] payload);

    /**
     * Reads the record stored at {@code address}.
     *
     * @param address an address previously returned by {@link #write(byte[])}
     * @return the record payload
     * @throws CorruptionException if the address is out of range or the
     *                             length prefix does not fit the store
     * @throws ClosedException     if the storage is closed
     */
    byte[] read(long address);

    // ========================================================================
    // Root Pointer
    // ========================================================================

    /**
     * Reads the committed root address from the header.
     * <p>
     * Always reads the header itself, so commits made by another writer since
     * the last call are observed.
     *
     * @return the root address, or empty if nothing was ever committed
     *         (or an empty tree was committed)
     */
    OptionalLong getRootAddress();

    /**
     * Publishes {@code address} as the new root.
     * <p>
     * This is the single point at which a new version becomes visible and
     * must be the last step of a commit.
     *
     * @param address the address of the new root record, or {@link #NO_ADDRESS}
     *                for an empty tree
     */
    void commitRootAddress(long address);

    // ========================================================================
    // Locking / Durability
    // ========================================================================

    /**
     * Acquires the exclusive write lock, blocking while another holder has it.
     *
     * @return true if the lock was newly acquired (the caller's view of the
     *         root may be stale and should be refreshed), false if this
     *         instance already held it
     * @throws LockException if the lock could not be acquired in time
     */
    boolean lock();

    /**
     * Releases the write lock if held. No-op otherwise.
     */
    void unlock();

    /**
     * Returns whether this instance currently holds the write lock.
     */
    boolean isLocked();

    /**
     * Durability barrier: forces all written records to physical storage.
     */
    void flush();

    /**
     * Returns whether {@link #close()} has been called.
     */
    boolean isClosed();

    /**
     * Closes the storage, releasing the lock if held. Idempotent.
     */
    @Override
    void close();
}
