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
 * Counts domains within one segment. Each worker creates its own aggregator; the source buffer is
 * the only state shared with other workers and it is never written.
 */
public final class SegmentAggregator {

    static final int EXPECTED_DOMAINS = 50_000;

    private static final byte CARRIAGE_RETURN = '\r';

    private final SourceBuffer buffer;
    private final int columnIndex;
    private final FieldExtractor extractor = new FieldExtractor();
    private final DomainNormalizer normalizer = new DomainNormalizer();

    public SegmentAggregator(SourceBuffer buffer, int columnIndex) {
        this.buffer = buffer;
        this.columnIndex = columnIndex;
    }

    public PartialCounts aggregate(Segment segment) {
        DomainTable domains = new DomainTable(EXPECTED_DOMAINS);
        long rows = 0;
        long skipped = 0;

        long lineStart = segment.start();
        long end = segment.end();
        while (lineStart < end) {
            long lineEnd = RecordSplitter.findLineEnd(buffer, lineStart, end);
            long next;
            if (lineEnd == RecordSplitter.NOT_FOUND) {
                // last record of the file without a trailing newline
                lineEnd = end;
                next = end;
            }
            else {
                next = lineEnd + 1;
            }
            if (lineEnd > lineStart && buffer.get(lineEnd - 1) == CARRIAGE_RETURN) {
                lineEnd--;
            }

            if (lineEnd > lineStart) {
                rows++;
                if (!count(lineStart, lineEnd, domains)) {
                    skipped++;
                }
            }
            lineStart = next;
        }
        return new PartialCounts(domains, rows, skipped);
    }

    private boolean count(long lineStart, long lineEnd, DomainTable domains) {
        if (!extractor.extract(buffer, lineStart, lineEnd, columnIndex)) {
            return false;
        }
        int length = normalizer.normalize(buffer, extractor.fieldStart(), extractor.fieldEnd());
        if (length == DomainNormalizer.INVALID) {
            return false;
        }
        domains.increment(normalizer.domain(), length, normalizer.hash());
        return true;
    }
}
