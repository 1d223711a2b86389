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

import java.util.ArrayList;
import java.util.List;

/**
 * Line handling on top of a {@link SourceBuffer}: header lookup and partitioning of the body into
 * segments that never split a record.
 * <p>
 * Fields are split on every comma. Quoted fields are not supported, a comma inside quotes still
 * starts a new field.
 */
public final class RecordSplitter {

    public static final long NOT_FOUND = -1;

    static final byte NEWLINE = '\n';
    static final byte DELIMITER = ',';

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private RecordSplitter() {
    }

    public static long findLineEnd(SourceBuffer buffer, long from) {
        return findLineEnd(buffer, from, buffer.size());
    }

    /**
     * Returns the offset of the first newline in {@code [from, limit)}, or {@link #NOT_FOUND}.
     */
    public static long findLineEnd(SourceBuffer buffer, long from, long limit) {
        for (long i = from; i < limit; i++) {
            if (buffer.get(i) == NEWLINE) {
                return i;
            }
        }
        return NOT_FOUND;
    }

    public static Header locateHeader(SourceBuffer buffer, String fieldName) throws SchemaException {
        long headerEnd = findLineEnd(buffer, 0);
        if (headerEnd == NOT_FOUND) {
            throw new SchemaException("invalid CSV: no newline in file");
        }

        String headerLine = buffer.toString(0, headerEnd);
        if (!headerLine.isEmpty() && headerLine.charAt(0) == BYTE_ORDER_MARK) {
            headerLine = headerLine.substring(1);
        }

        String[] names = headerLine.split(",", -1);
        for (int i = 0; i < names.length; i++) {
            if (names[i].trim().equalsIgnoreCase(fieldName)) {
                return new Header(i, headerEnd + 1);
            }
        }
        throw new SchemaException(fieldName + " column not found in CSV header: " + headerLine.trim());
    }

    public static List<Segment> partition(SourceBuffer buffer, long bodyStart, int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be positive: " + workerCount);
        }

        long size = buffer.size();
        long sliceSize = (size - bodyStart) / workerCount;
        List<Segment> segments = new ArrayList<>(workerCount);

        long start = bodyStart;
        for (int i = 0; i < workerCount && start < size; i++) {
            long end = start + sliceSize;
            if (i == workerCount - 1 || end >= size) {
                end = size;
            }
            else {
                // don't split a record, move the boundary past the next newline
                long lineEnd = findLineEnd(buffer, end);
                end = lineEnd == NOT_FOUND ? size : lineEnd + 1;
            }
            segments.add(new Segment(start, end));
            start = end;
        }
        return segments;
    }
}
