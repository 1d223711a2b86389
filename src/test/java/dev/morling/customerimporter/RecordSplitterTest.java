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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class RecordSplitterTest {

    private static final String CSV = "id,name,email\n"
            + "1,John,john@example.com\n"
            + "2,Jane,jane@domain.org\n"
            + "3,Bob,bob@example.com\n"
            + "4,Alice,alice@a-much-longer-domain-name.example\n"
            + "5,Eve,eve@x.io";

    @Test
    void findsLineEnds() {
        SourceBuffer buffer = SourceBuffer.wrap("ab\ncd\nef");

        assertThat(RecordSplitter.findLineEnd(buffer, 0)).isEqualTo(2);
        assertThat(RecordSplitter.findLineEnd(buffer, 2)).isEqualTo(2);
        assertThat(RecordSplitter.findLineEnd(buffer, 3)).isEqualTo(5);
        assertThat(RecordSplitter.findLineEnd(buffer, 6)).isEqualTo(RecordSplitter.NOT_FOUND);
        assertThat(RecordSplitter.findLineEnd(buffer, 3, 5)).isEqualTo(RecordSplitter.NOT_FOUND);
    }

    @Test
    void locatesEmailColumn() throws Exception {
        Header header = RecordSplitter.locateHeader(SourceBuffer.wrap(CSV), "email");

        assertThat(header.columnIndex()).isEqualTo(2);
        assertThat(header.bodyStart()).isEqualTo("id,name,email\n".length());
    }

    @Test
    void matchesColumnTrimmedAndIgnoringCase() throws Exception {
        Header header = RecordSplitter.locateHeader(SourceBuffer.wrap("\uFEFF Email ,id\r\n"), "email");

        assertThat(header.columnIndex()).isZero();
        assertThat(RecordSplitter.locateHeader(SourceBuffer.wrap("id, name ,E-Mail,EMAIL\n"), "email").columnIndex())
                .isEqualTo(3);
    }

    @Test
    void rejectsHeaderWithoutEmailColumn() {
        assertThatThrownBy(() -> RecordSplitter.locateHeader(SourceBuffer.wrap("id,name\n1,John\n"), "email"))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("email column not found");
    }

    @Test
    void rejectsFileWithoutNewline() {
        assertThatThrownBy(() -> RecordSplitter.locateHeader(SourceBuffer.wrap("id,name,email"), "email"))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("no newline");
        assertThatThrownBy(() -> RecordSplitter.locateHeader(SourceBuffer.wrap(""), "email"))
                .isInstanceOf(SchemaException.class);
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 2, 3, 4, 5, 7, 50, 1000 })
    void segmentsCoverTheBodyWithoutSplittingRecords(int workers) throws Exception {
        SourceBuffer buffer = SourceBuffer.wrap(CSV);
        long bodyStart = RecordSplitter.locateHeader(buffer, "email").bodyStart();

        List<Segment> segments = RecordSplitter.partition(buffer, bodyStart, workers);

        assertThat(segments).isNotEmpty().hasSizeLessThanOrEqualTo(workers);
        assertThat(segments.get(0).start()).isEqualTo(bodyStart);
        assertThat(segments.get(segments.size() - 1).end()).isEqualTo(buffer.size());

        StringBuilder joined = new StringBuilder();
        for (int i = 0; i < segments.size(); i++) {
            Segment segment = segments.get(i);
            if (i > 0) {
                assertThat(segment.start()).isEqualTo(segments.get(i - 1).end());
            }
            if (segment.end() < buffer.size()) {
                assertThat(buffer.get(segment.end() - 1)).isEqualTo((byte) '\n');
            }
            joined.append(buffer.toString(segment.start(), segment.end()));
        }
        assertThat(joined.toString()).isEqualTo(CSV.substring((int) bodyStart));
    }

    @Test
    void emptyBodyHasNoSegments() {
        SourceBuffer buffer = SourceBuffer.wrap("id,email\n");

        assertThat(RecordSplitter.partition(buffer, buffer.size(), 4)).isEmpty();
    }

    @Test
    void rejectsNonPositiveWorkerCount() {
        assertThatThrownBy(() -> RecordSplitter.partition(SourceBuffer.wrap(CSV), 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
