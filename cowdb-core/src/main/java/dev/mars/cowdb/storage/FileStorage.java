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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Single-file implementation of {@link Storage} using {@link FileChannel}.
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * offset 0   MAGIC 'COWD' (4) | FORMAT_VERSION (2) | reserved (2) | ROOT_ADDRESS (8)
 * offset 16  [LENGTH (4)][PAYLOAD] [LENGTH (4)][PAYLOAD] ...   append-only records
 * </pre>
 * All integers are big-endian. A root address of {@code 0} is the sentinel for
 * "empty tree"; no record can live at 0 because the header occupies it.
 * <p>
 * <b>Durability:</b>
 * <ul>
 *   <li>Records: appended with positional writes, never overwritten</li>
 *   <li>Root pointer: {@link #commitRootAddress(long)} forces the records,
 *       overwrites the 8-byte root slot in place, then forces again</li>
 * </ul>
 * <p>
 * <b>Locking:</b> the write lock is an exclusive {@link FileLock} over the whole
 * file. It is advisory: readers never take it. Acquisition polls until the
 * configured timeout expires. A lock held through another channel in this JVM
 * is treated as contention, the same as a lock held by another process.
 * <p>
 * <b>Thread Safety:</b> reads are positional and may run concurrently. Writes,
 * locking and commits belong to the single session that owns the instance.
 *
 * @see Storage
 * @see StorageConfig
 */
public final class FileStorage implements Storage {

    // ========================================================================
    // Logger
    // ========================================================================

    private static final Logger LOG = LoggerFactory.getLogger(FileStorage.class);

    // ========================================================================
    // Constants
    // ========================================================================

    /** Magic number: 'COWD' in ASCII */
    static final int MAGIC = 0x434F5744;

    /** File format version */
    static final short FORMAT_VERSION = 1;

    /** Header size: MAGIC(4) + FORMAT_VERSION(2) + RESERVED(2) + ROOT_ADDRESS(8) */
    public static final int HEADER_SIZE = 4 + 2 + 2 + 8;

    /** Offset of the root address slot within the header */
    static final int ROOT_OFFSET = 8;

    /** Record length prefix size */
    static final int LENGTH_PREFIX_SIZE = 4;

    /** Sleep between lock attempts while another holder has the lock */
    private static final long LOCK_POLL_INTERVAL_MS = 10;

    // ========================================================================
    // State
    // ========================================================================

    private final Path path;
    private final StorageConfig config;
    private final boolean syncEnabled;
    private final int maxRecordSize;
    private final FileChannel channel;

    private FileLock writeLock;
    private volatile boolean closed = false;

    private FileStorage(Path path, StorageConfig config, FileChannel channel) {
        this.path = path;
        this.config = config;
        this.syncEnabled = config.syncEnabled();
        this.maxRecordSize = config.maxRecordSizeBytes();
        this.channel = channel;
    }

    // ========================================================================
    // Open / Close
    // ========================================================================

    /**
     * Opens the store at {@code path} with configuration loaded from
     * system properties, environment variables, properties file, or defaults.
     *
     * @see #open(Path, StorageConfig)
     */
    public static FileStorage open(Path path) {
        return open(path, StorageConfig.load());
    }

    /**
     * Opens an existing store, or creates a new one holding an empty tree.
     *
     * @param path   the database file
     * @param config the storage configuration
     * @return the opened storage
     * @throws CorruptionException if the file exists but is not a cowdb store
     * @throws StorageException    if the file cannot be opened
     */
    public static FileStorage open(Path path, StorageConfig config) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(config, "config");
        LOG.info("Opening storage at: {}", path);

        FileChannel channel = null;
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            channel = FileChannel.open(path,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.READ,
                    StandardOpenOption.WRITE);

            long size = channel.size();
            if (size < HEADER_SIZE) {
                // A torn header cannot be referenced by anything yet
                if (size > 0) {
                    LOG.warn("Incomplete header ({} bytes), reinitializing {}", size, path);
                    channel.truncate(0);
                }
                writeHeader(channel, config.syncEnabled());
                LOG.info("Created new store: path={}", path);
            } else {
                validateHeader(channel, path);
                LOG.info("Storage opened successfully: path={}, size={} bytes", path, size);
            }

            return new FileStorage(path, config, channel);

        } catch (IOException e) {
            LOG.error("Failed to open storage at {}: {}", path, e.getMessage(), e);
            closeChannel(channel);
            throw new StorageException("Failed to open storage at " + path, e);
        } catch (RuntimeException e) {
            closeChannel(channel);
            throw e;
        }
    }

    @Override
    public void close() {
        if (closed) {
            LOG.debug("Storage already closed, ignoring duplicate close()");
            return;
        }
        closed = true;
        LOG.info("Closing storage at: {}", path);

        try {
            releaseWriteLock();
        } catch (IOException e) {
            LOG.warn("Could not release write lock: {}", e.getMessage());
        }
        closeChannel(channel);
        LOG.info("Storage closed");
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    /** The database file. */
    public Path path() {
        return path;
    }

    /** Returns the configuration used by this storage instance. */
    public StorageConfig config() {
        return config;
    }

    /**
     * Current file length in bytes. Every address is smaller than this.
     */
    public long size() {
        ensureOpen();
        try {
            return channel.size();
        } catch (IOException e) {
            throw new StorageException("Failed to read size of " + path, e);
        }
    }

    // ========================================================================
    // Records
    // ========================================================================

    @Override
    public long write(byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        ensureOpen();
        if (payload.length > maxRecordSize) {
            LOG.error("Record too large: {} bytes (max: {})", payload.length, maxRecordSize);
            throw new StorageException("Record too large: " + payload.length +
                    " bytes (max: " + maxRecordSize + ")");
        }

        try {
            long address = channel.size();
            ByteBuffer buf = ByteBuffer.allocate(LENGTH_PREFIX_SIZE + payload.length);
            buf.putInt(payload.length);
            buf.put(payload);
            buf.flip();

            long position = address;
            while (buf.hasRemaining()) {
                position += channel.write(buf, position);
            }
            LOG.trace("Wrote record: address={}, payloadLen={}", address, payload.length);
            return address;

        } catch (IOException e) {
            LOG.error("Failed to write record: {}", e.getMessage(), e);
            throw new StorageException("Failed to write record to " + path, e);
        }
    }

    @Override
    public byte[] read(long address) {
        ensureOpen();
        try {
            long size = channel.size();
            if (address < HEADER_SIZE || address > size - LENGTH_PREFIX_SIZE) {
                LOG.error("Address out of range: {} (store size {} bytes)", address, size);
                throw new CorruptionException("Address out of range: " + address +
                        " (store size " + size + " bytes)");
            }

            ByteBuffer lengthBuf = ByteBuffer.allocate(LENGTH_PREFIX_SIZE);
            readFully(lengthBuf, address);
            int length = lengthBuf.getInt(0);

            long remaining = size - address - LENGTH_PREFIX_SIZE;
            if (length < 0 || length > maxRecordSize || length > remaining) {
                LOG.error("Invalid record length at {}: {} ({} bytes remaining)", address, length, remaining);
                throw new CorruptionException("Invalid record length at address " + address +
                        ": " + length + " (" + remaining + " bytes remaining)");
            }

            ByteBuffer payload = ByteBuffer.allocate(length);
            readFully(payload, address + LENGTH_PREFIX_SIZE);
            LOG.trace("Read record: address={}, payloadLen={}", address, length);
            return payload.array();

        } catch (IOException e) {
            LOG.error("Failed to read record at {}: {}", address, e.getMessage(), e);
            throw new StorageException("Failed to read record at address " + address, e);
        }
    }

    // ========================================================================
    // Root Pointer
    // ========================================================================

    @Override
    public OptionalLong getRootAddress() {
        ensureOpen();
        try {
            ByteBuffer buf = ByteBuffer.allocate(8);
            readFully(buf, ROOT_OFFSET);
            long address = buf.getLong(0);
            if (address == NO_ADDRESS) {
                return OptionalLong.empty();
            }
            if (address < HEADER_SIZE) {
                throw new CorruptionException("Root address points into the header: " + address);
            }
            return OptionalLong.of(address);

        } catch (IOException e) {
            LOG.error("Failed to read root address: {}", e.getMessage(), e);
            throw new StorageException("Failed to read root address from " + path, e);
        }
    }

    @Override
    public void commitRootAddress(long address) {
        ensureOpen();
        if (address != NO_ADDRESS && address < HEADER_SIZE) {
            throw new IllegalArgumentException("Not a record address: " + address);
        }

        try {
            // Every record the new root reaches must be durable before the header points at it
            if (syncEnabled) {
                channel.force(true);
            }

            ByteBuffer buf = ByteBuffer.allocate(8);
            buf.putLong(address);
            buf.flip();
            long position = ROOT_OFFSET;
            while (buf.hasRemaining()) {
                position += channel.write(buf, position);
            }

            if (syncEnabled) {
                channel.force(true);
            }
            LOG.debug("Root address committed: {}", address);

        } catch (IOException e) {
            LOG.error("Failed to commit root address {}: {}", address, e.getMessage(), e);
            throw new StorageException("Failed to commit root address " + address, e);
        }
    }

    // ========================================================================
    // Locking / Durability
    // ========================================================================

    @Override
    public boolean lock() {
        ensureOpen();
        if (isLocked()) {
            return false;
        }

        long timeoutMs = config.lockTimeoutMs();
        long deadline = System.nanoTime() + timeoutMs * 1_000_000L;
        LOG.debug("Acquiring write lock: {}", path);

        try {
            while (true) {
                FileLock acquired = tryAcquire();
                if (acquired != null) {
                    writeLock = acquired;
                    LOG.debug("Write lock acquired: {}", path);
                    return true;
                }
                if (timeoutMs > 0 && System.nanoTime() - deadline >= 0) {
                    LOG.warn("Timed out after {} ms waiting for write lock on {}", timeoutMs, path);
                    throw new LockException("Timed out after " + timeoutMs +
                            " ms waiting for write lock on " + path);
                }
                Thread.sleep(LOCK_POLL_INTERVAL_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockException("Interrupted while waiting for write lock on " + path, e);
        } catch (IOException e) {
            LOG.error("Failed to acquire write lock: {}", e.getMessage(), e);
            throw new StorageException("Failed to acquire write lock on " + path, e);
        }
    }

    @Override
    public void unlock() {
        try {
            releaseWriteLock();
        } catch (IOException e) {
            LOG.error("Failed to release write lock: {}", e.getMessage(), e);
            throw new StorageException("Failed to release write lock on " + path, e);
        }
    }

    @Override
    public boolean isLocked() {
        return writeLock != null && writeLock.isValid();
    }

    @Override
    public void flush() {
        ensureOpen();
        if (!syncEnabled) {
            LOG.trace("flush() called but fsync is disabled");
            return;
        }
        try {
            long startNanos = System.nanoTime();
            channel.force(true);
            LOG.debug("Storage synced to disk in {} us", (System.nanoTime() - startNanos) / 1000);
        } catch (IOException e) {
            LOG.error("Failed to sync storage: {}", e.getMessage(), e);
            throw new StorageException("Failed to sync " + path, e);
        }
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private void ensureOpen() {
        if (closed) {
            throw new ClosedException("Storage is closed: " + path);
        }
    }

    private FileLock tryAcquire() throws IOException {
        try {
            return channel.tryLock();
        } catch (OverlappingFileLockException e) {
            LOG.trace("Write lock held through another channel in this JVM");
            return null;
        }
    }

    private void releaseWriteLock() throws IOException {
        FileLock held = writeLock;
        writeLock = null;
        if (held != null && held.isValid()) {
            held.release();
            LOG.debug("Write lock released: {}", path);
        }
    }

    private void readFully(ByteBuffer buf, long position) throws IOException {
        long pos = position;
        while (buf.hasRemaining()) {
            int read = channel.read(buf, pos);
            if (read < 0) {
                throw new CorruptionException("Unexpected end of file at " + pos + " in " + path);
            }
            pos += read;
        }
    }

    private static void writeHeader(FileChannel channel, boolean sync) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(HEADER_SIZE);
        buf.putInt(MAGIC);
        buf.putShort(FORMAT_VERSION);
        buf.putShort((short) 0);
        buf.putLong(NO_ADDRESS);
        buf.flip();

        long position = 0;
        while (buf.hasRemaining()) {
            position += channel.write(buf, position);
        }
        if (sync) {
            channel.force(true);
        }
    }

    private static void validateHeader(FileChannel channel, Path path) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(HEADER_SIZE);
        long position = 0;
        while (buf.hasRemaining()) {
            int read = channel.read(buf, position);
            if (read < 0) {
                throw new CorruptionException("Truncated header in " + path);
            }
            position += read;
        }
        buf.flip();

        int magic = buf.getInt();
        short version = buf.getShort();
        if (magic != MAGIC) {
            LOG.error("Invalid header in {}: magic=0x{}", path, Integer.toHexString(magic));
            throw new CorruptionException("Not a cowdb file (bad magic 0x" +
                    Integer.toHexString(magic) + "): " + path);
        }
        if (version != FORMAT_VERSION) {
            LOG.error("Unsupported format version in {}: {}", path, version);
            throw new CorruptionException("Unsupported format version " + version + ": " + path);
        }
    }

    private static void closeChannel(FileChannel channel) {
        if (channel == null || !channel.isOpen()) {
            return;
        }
        try {
            channel.close();
            LOG.trace("Storage channel closed");
        } catch (IOException e) {
            LOG.warn("Error closing storage channel: {}", e.getMessage());
        }
    }
}
