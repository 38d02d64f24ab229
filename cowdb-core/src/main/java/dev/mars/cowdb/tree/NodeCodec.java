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
import dev.mars.cowdb.storage.Storage;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.List;

/**
 * Node record codec.
 * <p>
 * Layout (big-endian):
 * <pre>
 * TYPE_NODE(1) | VERSION(1) | LEFT(8) | KEY_LEN(4) | KEY(var) | VALUE(8) | RIGHT(8) | SIZE(8)
 * </pre>
 * Children and value are written as addresses, never inline, and decode to
 * unloaded references.
 */
final class NodeCodec<K, V> implements Codec<Node<K, V>> {

    /** Fixed body size: LEFT(8) + KEY_LEN(4) + VALUE(8) + RIGHT(8) + SIZE(8) */
    private static final int FIXED_BODY_SIZE = 8 + 4 + 8 + 8 + 8;

    private final Codec<K> keyCodec;
    private final Codec<V> valueCodec;

    NodeCodec(Codec<K> keyCodec, Codec<V> valueCodec) {
        this.keyCodec = keyCodec;
        this.valueCodec = valueCodec;
    }

    @Override
    public List<Ref<?>> references(Node<K, V> node) {
        return List.of(node.valueRef(), node.left(), node.right());
    }

    @Override
    public byte[] encode(Node<K, V> node) {
        byte[] key = keyCodec.encode(node.key());
        ByteBuffer buf = RecordFormat.allocate(RecordFormat.TYPE_NODE, FIXED_BODY_SIZE + key.length);
        buf.putLong(addressOf(node.left(), "left"));
        buf.putInt(key.length);
        buf.put(key);
        buf.putLong(addressOf(node.valueRef(), "value"));
        buf.putLong(addressOf(node.right(), "right"));
        buf.putLong(node.size());
        return buf.array();
    }

    @Override
    public Node<K, V> decode(byte[] bytes) {
        ByteBuffer buf = RecordFormat.open(bytes, RecordFormat.TYPE_NODE);
        try {
            long left = checkedAddress(buf.getLong(), "left");
            int keyLength = buf.getInt();
            if (keyLength < 0 || keyLength > buf.remaining() - 24) {
                throw new CorruptionException("Invalid key length in node record: " + keyLength);
            }
            byte[] key = new byte[keyLength];
            buf.get(key);
            long value = checkedAddress(buf.getLong(), "value");
            long right = checkedAddress(buf.getLong(), "right");
            long size = buf.getLong();

            if (value == Storage.NO_ADDRESS) {
                throw new CorruptionException("Node record without a value address");
            }
            if (size < 1) {
                throw new CorruptionException("Invalid subtree size in node record: " + size);
            }
            return new Node<>(keyCodec.decode(key),
                    Ref.at(value, valueCodec),
                    Ref.at(left, this),
                    Ref.at(right, this),
                    size);

        } catch (BufferUnderflowException e) {
            throw new CorruptionException("Truncated node record (" + bytes.length + " bytes)", e);
        }
    }

    private static long addressOf(Ref<?> ref, String slot) {
        if (!ref.isAbsent() && !ref.isStored()) {
            throw new IllegalStateException("Cannot encode node: " + slot + " reference is not stored");
        }
        return ref.address();
    }

    private static long checkedAddress(long address, String slot) {
        if (address < 0) {
            throw new CorruptionException("Negative " + slot + " address in node record: " + address);
        }
        return address;
    }
}
