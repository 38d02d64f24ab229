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
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Lazy, write-once reference to a referent held in memory, in storage, or both.
 * <p>
 * A reference is always in one of four states:
 * <pre>
 * ABSENT    no referent, no address     empty child slot / empty tree
 * UNSTORED  referent, no address        built by an insert or delete
 * UNLOADED  address, no referent        decoded from a parent record
 * LOADED    referent and address        stored, or read back from storage
 * </pre>
 * An address is assigned at most once and the record behind it is never
 * rewritten, so a LOADED reference can be shared freely between tree versions.
 *
 * @param <T> the referent type
 */
public final class Ref<T> {

    /** State of a reference. */
    public enum State { ABSENT, UNSTORED, UNLOADED, LOADED }

    private final Codec<T> codec;
    private volatile T referent;
    private volatile long address;

    private Ref(Codec<T> codec, T referent, long address) {
        this.codec = codec;
        this.referent = referent;
        this.address = address;
    }

    /**
     * An absent reference. Absent references are equivalent; test with
     * {@link #isAbsent()}, not identity.
     */
    public static <T> Ref<T> absent() {
        return new Ref<>(null, null, Storage.NO_ADDRESS);
    }

    /**
     * A new, not yet stored reference to {@code referent}.
     */
    public static <T> Ref<T> of(T referent, Codec<T> codec) {
        return new Ref<>(Objects.requireNonNull(codec, "codec"),
                Objects.requireNonNull(referent, "referent"), Storage.NO_ADDRESS);
    }

    /**
     * A reference to the record at {@code address}, loaded on first {@link #get}.
     * {@link Storage#NO_ADDRESS} yields the absent reference.
     */
    public static <T> Ref<T> at(long address, Codec<T> codec) {
        if (address == Storage.NO_ADDRESS) {
            return absent();
        }
        if (address < 0) {
            throw new IllegalArgumentException("Negative address: " + address);
        }
        return new Ref<>(Objects.requireNonNull(codec, "codec"), null, address);
    }

    public State state() {
        boolean loaded = referent != null;
        boolean stored = address != Storage.NO_ADDRESS;
        if (stored) {
            return loaded ? State.LOADED : State.UNLOADED;
        }
        return loaded ? State.UNSTORED : State.ABSENT;
    }

    /** True for the absent reference. Never touches storage. */
    public boolean isAbsent() {
        return referent == null && address == Storage.NO_ADDRESS;
    }

    /** True once an address has been assigned. */
    public boolean isStored() {
        return address != Storage.NO_ADDRESS;
    }

    /**
     * The address of the referent's record, or {@link Storage#NO_ADDRESS} if not stored.
     */
    public long address() {
        return address;
    }

    /**
     * Returns the referent, reading and decoding it on first use.
     *
     * @param storage the storage the address belongs to
     * @return the referent, or {@code null} for the absent reference
     * @throws dev.mars.cowdb.storage.CorruptionException if the record cannot be decoded
     */
    public T get(Storage storage) {
        T cached = referent;
        if (cached != null) {
            return cached;
        }
        long addr = address;
        if (addr == Storage.NO_ADDRESS) {
            return null;
        }
        // Concurrent loads decode the same immutable record, so either result may win
        T loaded = codec.decode(storage.read(addr));
        referent = loaded;
        return loaded;
    }

    /**
     * Stores the referent if it has no address yet and returns the address.
     * <p>
     * Calling this again is a no-op that returns the same address without
     * writing. Unstored references listed by {@link Codec#references} are
     * stored first, depth first with an explicit stack, so every record is
     * written after the records it addresses however deep the graph is.
     *
     * @param storage the storage to write to
     * @return the record address, or {@link Storage#NO_ADDRESS} for the absent reference
     */
    public synchronized long store(Storage storage) {
        if (address != Storage.NO_ADDRESS || referent == null) {
            return address;
        }

        Deque<Ref<?>> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            Ref<?> top = pending.peek();
            List<Ref<?>> unstored = top.unstoredReferences();
            if (unstored.isEmpty()) {
                pending.pop();
                top.writeRecord(storage);
            } else {
                unstored.forEach(pending::push);
            }
        }
        return address;
    }

    private List<Ref<?>> unstoredReferences() {
        T value = referent;
        if (address != Storage.NO_ADDRESS || value == null) {
            return List.of();
        }
        List<Ref<?>> unstored = new ArrayList<>();
        for (Ref<?> ref : codec.references(value)) {
            if (!ref.isStored() && !ref.isAbsent()) {
                unstored.add(ref);
            }
        }
        return unstored;
    }

    private synchronized void writeRecord(Storage storage) {
        // A reference shared by two parents can be reached twice
        if (address != Storage.NO_ADDRESS) {
            return;
        }
        address = storage.write(codec.encode(referent));
    }

    @Override
    public String toString() {
        return "Ref{state=" + state() + ", address=" + address + '}';
    }
}
