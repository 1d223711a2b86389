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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Extracts the lowercased domain from an e-mail address.
 * <p>
 * The domain is whatever follows the last {@code @}. It must contain a dot and be at least three
 * bytes long. Only ASCII letters are folded. The result is written to an internal scratch array
 * which is reused between calls, so instances must not be shared between threads.
 */
public final class DomainNormalizer {

    public static final int INVALID = -1;

    static final byte SEPARATOR = '@';
    static final int MIN_DOMAIN_LENGTH = 3;

    private byte[] domain = new byte[128];
    private int hash;

    /**
     * Normalizes the address in {@code [start, end)} and returns the domain length, or
     * {@link #INVALID}.
     */
    public int normalize(SourceBuffer buffer, long start, long end) {
        long at = end - 1;
        while (at >= start && buffer.get(at) != SEPARATOR) {
            at--;
        }
        if (at < start || at == end - 1) {
            return INVALID;
        }

        long domainStart = at + 1;
        long length = end - domainStart;
        if (length < MIN_DOMAIN_LENGTH) {
            return INVALID;
        }
        if (length > domain.length) {
            domain = new byte[Math.toIntExact(Math.max(length, domain.length * 2L))];
        }

        int h = 0;
        boolean hasDot = false;
        for (int i = 0; i < length; i++) {
            byte b = buffer.get(domainStart + i);
            if (b >= 'A' && b <= 'Z') {
                b += 'a' - 'A';
            }
            else if (b == '.') {
                hasDot = true;
            }
            domain[i] = b;
            h = 31 * h + b;
        }
        if (!hasDot) {
            return INVALID;
        }

        hash = h;
        return (int) length;
    }

    /**
     * Scratch array holding the domain of the last successful {@link #normalize} call.
     */
    public byte[] domain() {
        return domain;
    }

    public int hash() {
        return hash;
    }

    /**
     * Convenience variant for a single address; returns {@code null} for invalid input.
     */
    public static String normalize(String address) {
        DomainNormalizer normalizer = new DomainNormalizer();
        SourceBuffer buffer = SourceBuffer.wrap(address);
        int length = normalizer.normalize(buffer, 0, buffer.size());
        if (length == INVALID) {
            return null;
        }
        return new String(Arrays.copyOf(normalizer.domain, length), StandardCharsets.UTF_8);
    }
}
