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

import java.nio.file.Path;

public final class OutputPaths {

    static final String SUFFIX = "_output";

    private OutputPaths() {
    }

    /**
     * {@code data/customers.csv} becomes {@code data/<outputDirectory>/customers_output.csv}.
     */
    public static Path derive(Path input, String outputDirectory) {
        Path directory = input.toAbsolutePath().getParent();
        if (!outputDirectory.isEmpty()) {
            directory = directory.resolve(outputDirectory);
        }

        String fileName = input.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String name = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = dot > 0 ? fileName.substring(dot) : "";
        return directory.resolve(name + SUFFIX + extension);
    }

    public static Path derive(Path input) {
        return derive(input, ImporterOptions.DEFAULT_OUTPUT_DIRECTORY);
    }
}
