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

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CreateCustomersTest {

    @TempDir
    Path dir;

    @Test
    void writesHeaderAndRequestedRows() throws Exception {
        Path file = dir.resolve("samples/customers.csv");

        CreateCustomers.write(file, 100, 1L, false);

        List<String> lines = Files.readAllLines(file);
        assertThat(lines).hasSize(101);
        assertThat(lines.get(0)).isEqualTo(CreateCustomers.HEADER);
        for (String line : lines.subList(1, lines.size())) {
            String[] fields = line.split(",");
            assertThat(fields).hasSize(5);
            assertThat(CreateCustomers.DOMAINS).contains(fields[2].substring(fields[2].indexOf('@') + 1));
            assertThat(fields[4]).matches("\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}");
        }
    }

    @Test
    void sameSeedGivesSameFile() throws Exception {
        Path first = dir.resolve("first.csv");
        Path second = dir.resolve("second.csv");

        CreateCustomers.write(first, 500, 42L, false);
        CreateCustomers.write(second, 500, 42L, false);

        assertThat(Files.readAllBytes(second)).isEqualTo(Files.readAllBytes(first));
    }

    @Test
    void uniqueDomainsMode() throws Exception {
        Path file = dir.resolve("unique.csv");

        CreateCustomers.write(file, 3, 1L, true);

        assertThat(Files.readAllLines(file)).containsExactly(
                CreateCustomers.HEADER,
                "First0,Last0,user0@domain0.com,Male,0.0.0.0",
                "First1,Last1,user1@domain1.com,Female,1.0.0.0",
                "First2,Last2,user2@domain2.com,Male,2.0.0.0");
    }
}
