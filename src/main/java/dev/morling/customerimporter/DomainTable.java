/*
 *  Copyright 2023 The original authors
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package dev.morling.customerimporter;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.function.ObjLongConsumer;

/**
 * Open addressing hash table counting occurrences of byte keys. A key is copied only the first
 * time it is seen, repeated domains cost a probe and an increment. Not thread-safe.
 * <p>
 * Keys are exposed as ISO-8859-1 strings, one char per byte, so distinct byte sequences stay
 * distinct and {@link String#compareTo} orders them like unsigned bytes.
 */
public final class DomainTable {

    public static final Charset KEY_CHARSET = StandardCharsets.ISO_8859_1;

    private byte[][] keys;
    private int[] hashes;
    private long[] counts;
    private int mask;
    private int size;

    public DomainTable(int expectedSize) {
        int capacity = 16;
        while (capacity < expectedSize * 2) {
            capacity <<= 1;
        }
        allocate(capacity);
    }

    private void allocate(int capacity) {
        keys = new byte[capacity][];
        hashes = new int[capacity];
        counts = new long[capacity];
        mask = capacity - 1;
    }

    public void increment(byte[] key, int length, int hash) {
        add(key, length, hash, 1);
    }

    public void add(byte[] key, int length, int hash, long delta) {
        int index = spread(hash) & mask;
        while (true) {
            byte[] existing = keys[index];
            if (existing == null) {
                keys[index] = Arrays.copyOf(key, length);
                hashes[index] = hash;
                counts[index] = delta;
                if (++size * 2 > keys.length) {
                    grow();
                }
                return;
            }
            if (hashes[index] == hash && Arrays.equals(existing, 0, existing.length, key, 0, length)) {
                counts[index] += delta;
                return;
            }
            index = (index + 1) & mask;
        }
    }

    long count(String domain) {
        byte[] key = domain.getBytes(KEY_CHARSET);
        int hash = hashOf(key, key.length);
        int index = spread(hash) & mask;
        while (keys[index] != null) {
            if (hashes[index] == hash && Arrays.equals(keys[index], key)) {
                return counts[index];
            }
            index = (index + 1) & mask;
        }
        return 0;
    }

    public int size() {
        return size;
    }

    long total() {
        long total = 0;
        for (int i = 0; i < keys.length; i++) {
            if (keys[i] != null) {
                total += counts[i];
            }
        }
        return total;
    }

    public void forEach(ObjLongConsumer<String> consumer) {
        for (int i = 0; i < keys.length; i++) {
            if (keys[i] != null) {
                consumer.accept(new String(keys[i], KEY_CHARSET), counts[i]);
            }
        }
    }

    private void grow() {
        byte[][] oldKeys = keys;
        int[] oldHashes = hashes;
        long[] oldCounts = counts;
        allocate(oldKeys.length << 1);
        for (int i = 0; i < oldKeys.length; i++) {
            if (oldKeys[i] != null) {
                int index = spread(oldHashes[i]) & mask;
                while (keys[index] != null) {
                    index = (index + 1) & mask;
                }
                keys[index] = oldKeys[i];
                hashes[index] = oldHashes[i];
                counts[index] = oldCounts[i];
            }
        }
    }

    static int hashOf(byte[] key, int length) {
        int h = 0;
        for (int i = 0; i < length; i++) {
            h = 31 * h + key[i];
        }
        return h;
    }

    private static int spread(int hash) {
        return hash ^ (hash >>> 16);
    }
}
