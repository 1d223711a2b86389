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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.junit.jupiter.api.Test;

class DomainRankingTest {

    @Test
    void mergeSumsSameDomains() {
        PartialCounts first = partial(Map.of("example.com", 2L, "domain.org", 1L));
        PartialCounts second = partial(Map.of("example.com", 5L, "other.net", 3L));

        Map<String, Long> merged = DomainRanking.merge(List.of(first, second));

        assertThat(merged).containsOnly(
                Map.entry("example.com", 7L),
                Map.entry("domain.org", 1L),
                Map.entry("other.net", 3L));
    }

    @Test
    void mergeIsIndependentOfOrder() {
        Random random = new Random(42);
        List<PartialCounts> partials = new ArrayList<>();
        for (int p = 0; p < 6; p++) {
            Map<String, Long> counts = new HashMap<>();
            for (int i = 0; i < 200; i++) {
                counts.merge("d" + random.nextInt(50) + ".com", 1L + random.nextInt(3), Long::sum);
            }
            partials.add(partial(counts));
        }

        Map<String, Long> expected = DomainRanking.merge(partials);
        for (int shuffle = 0; shuffle < 10; shuffle++) {
            Collections.shuffle(partials, random);
            assertThat(DomainRanking.merge(partials)).isEqualTo(expected);
        }
    }

    @Test
    void ranksByCountThenDomain() {
        Map<String, Long> counts = Map.of(
                "beta.com", 3L,
                "alpha.com", 3L,
                "gamma.io", 7L,
                "delta.org", 1L,
                "aaa.org", 1L);

        List<DomainCount> ranked = DomainRanking.rank(counts);

        assertThat(ranked).containsExactly(
                new DomainCount("gamma.io", 7),
                new DomainCount("alpha.com", 3),
                new DomainCount("beta.com", 3),
                new DomainCount("aaa.org", 1),
                new DomainCount("delta.org", 1));
    }

    @Test
    void rankingIsStrictTotalOrder() {
        Random random = new Random(7);
        Map<String, Long> counts = new HashMap<>();
        for (int i = 0; i < 1_000; i++) {
            counts.put("domain" + i + ".com", (long) random.nextInt(20));
        }

        List<DomainCount> ranked = DomainRanking.rank(counts);

        assertThat(ranked).hasSize(counts.size());
        for (int i = 1; i < ranked.size(); i++) {
            DomainCount previous = ranked.get(i - 1);
            DomainCount current = ranked.get(i);
            boolean ordered = previous.count() > current.count()
                    || (previous.count() == current.count() && previous.domain().compareTo(current.domain()) < 0);
            assertThat(ordered).as("%s before %s", previous, current).isTrue();
        }
    }

    @Test
    void mergeOfNothingIsEmpty() {
        assertThat(DomainRanking.merge(List.of())).isEmpty();
        assertThat(DomainRanking.rank(Map.of())).isEmpty();
    }

    private static PartialCounts partial(Map<String, Long> counts) {
        DomainTable table = new DomainTable(counts.size());
        long rows = 0;
        for (Map.Entry<String, Long> entry : counts.entrySet()) {
            byte[] key = entry.getKey().getBytes(DomainTable.KEY_CHARSET);
            table.add(key, key.length, DomainTable.hashOf(key, key.length), entry.getValue());
            rows += entry.getValue();
        }
        return new PartialCounts(table, rows, 0);
    }
}
