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

import dev.mars.cowdb.storage.CorruptionException;

import java.nio.ByteBuffer;

/**
 * Prefix shared by every record payload written by the tree:
 * {@code TYPE(1) + VERSION(1)}, followed by the type-specific body.
 */
final class RecordFormat {

    /** Record type: tree node */
    static final byte TYPE_NODE = 1;

    /** Record type: stored value */
    static final byte TYPE_VALUE = 2;

    /** Record format version */
    static final byte VERSION = 1;

    /** Prefix size: TYPE(1) + VERSION(1) */
    static final int PREFIX_SIZE = 2;

    private RecordFormat() {
    }

    /**
     * Allocates a buffer for a record of {@code type} with room for
     * {@code bodySize} bytes after the prefix, prefix already written.
     */
    static ByteBuffer allocate(byte type, int bodySize) {
        ByteBuffer buf = ByteBuffer.allocate(PREFIX_SIZE + bodySize);
        buf.put(type);
        buf.put(VERSION);
        return buf;
    }

    /**
     * Checks the prefix of {@code payload} and returns a buffer positioned at the body.
     *
     * @throws CorruptionException if the type or version does not match
     */
    static ByteBuffer open(byte[] payload, byte expectedType) {
        if (payload.length < PREFIX_SIZE) {
            throw new CorruptionException("Record too short: " + payload.length + " bytes");
        }
        ByteBuffer buf = ByteBuffer.wrap(payload);
        byte type = buf.get();
        byte version = buf.get();
        if (type != expectedType) {
            throw new CorruptionException("Unexpected record type " + type + " (expected " + expectedType + ")");
        }
        if (version != VERSION) {
            throw new CorruptionException("Unsupported record version " + version + " for type " + type);
        }
        return buf;
    }
}
