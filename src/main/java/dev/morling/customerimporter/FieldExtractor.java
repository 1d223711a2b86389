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

/**
 * Locates one comma separated field within a line. Keeps the bounds of the last match, so one
 * instance is meant to be owned by a single worker.
 */
public final class FieldExtractor {

    private long fieldStart;
    private long fieldEnd;

    /**
     * Returns {@code true} if the line has a non-empty field at {@code columnIndex}; its bounds are
     * then available from {@link #fieldStart()} and {@link #fieldEnd()}.
     */
    public boolean extract(SourceBuffer buffer, long lineStart, long lineEnd, int columnIndex) {
        long start = lineStart;
        int field = 0;
        for (long i = lineStart; i <= lineEnd; i++) {
            if (i == lineEnd || buffer.get(i) == RecordSplitter.DELIMITER) {
                if (field == columnIndex) {
                    fieldStart = start;
                    fieldEnd = i;
                    return i > start;
                }
                field++;
                start = i + 1;
            }
        }
        return false;
    }

    public long fieldStart() {
        return fieldStart;
    }

    public long fieldEnd() {
        return fieldEnd;
    }
}
