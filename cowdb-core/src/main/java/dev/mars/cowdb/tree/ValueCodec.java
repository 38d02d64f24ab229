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

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Frames a caller's value codec as a typed, versioned value record.
 * <p>
 * Layout: {@code TYPE_VALUE(1) + VERSION(1) + value bytes}.
 */
final class ValueCodec<V> implements Codec<V> {

    private final Codec<V> delegate;

    ValueCodec(Codec<V> delegate) {
        this.delegate = delegate;
    }

    @Override
    public byte[] encode(V value) {
        byte[] body = delegate.encode(value);
        ByteBuffer buf = RecordFormat.allocate(RecordFormat.TYPE_VALUE, body.length);
        buf.put(body);
        return buf.array();
    }

    @Override
    public V decode(byte[] bytes) {
        RecordFormat.open(bytes, RecordFormat.TYPE_VALUE);
        return delegate.decode(Arrays.copyOfRange(bytes, RecordFormat.PREFIX_SIZE, bytes.length));
    }
}
