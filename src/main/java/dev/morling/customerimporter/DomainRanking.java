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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class DomainRanking {

    private DomainRanking() {
    }

    public static Map<String, Long> merge(List<PartialCounts> partials) {
        int expected = 16;
        for (PartialCounts partial : partials) {
            expected = Math.max(expected, partial.domains().size());
        }

        Map<String, Long> merged = new HashMap<>(expected * 2);
        for (PartialCounts partial : partials) {
            partial.domains().forEach((domain, count) -> merged.merge(domain, count, Long::sum));
        }
        return merged;
    }

    public static List<DomainCount> rank(Map<String, Long> counts) {
        List<DomainCount> ranked = new ArrayList<>(counts.size());
        counts.forEach((domain, count) -> ranked.add(new DomainCount(domain, count)));
        ranked.sort(DomainCount.RANKING);
        return ranked;
    }
}
