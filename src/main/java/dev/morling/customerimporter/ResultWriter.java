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

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the ranked domains as {@code Domain,Count} CSV. Domains are encoded with
 * {@link DomainTable#KEY_CHARSET}, which reproduces the input bytes. The file is written in place,
 * a failure part way leaves a truncated file behind.
 */
public final class ResultWriter {

    public static final String HEADER = "Domain,Count";

    private static final int BUFFER_SIZE = 1024 * 1024;

    private ResultWriter() {
    }

    public static void write(Path path, List<DomainCount> ranked) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
        }
        catch (IOException e) {
            throw new IOException("Failed to create output directory: " + parent, e);
        }

        try (BufferedWriter writer = new BufferedWriter(
                new OutputStreamWriter(Files.newOutputStream(path), DomainTable.KEY_CHARSET), BUFFER_SIZE)) {
            writer.write(HEADER);
            writer.write('\n');
            for (DomainCount entry : ranked) {
                writer.write(entry.domain());
                writer.write(',');
                writer.write(Long.toString(entry.count()));
                writer.write('\n');
            }
        }
        catch (IOException e) {
            throw new IOException("Failed to write results to: " + path, e);
        }
    }
}
