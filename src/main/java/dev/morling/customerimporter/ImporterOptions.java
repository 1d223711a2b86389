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
 * Tunables of an import run.
 *
 * @param column name of the header column holding the e-mail address, matched ignoring case
 * @param workers number of segments the body is split into, one worker each
 * @param outputDirectory directory next to the input receiving the result, empty for the input's own directory
 */
public record ImporterOptions(String column, int workers, String outputDirectory) {

    public static final String DEFAULT_COLUMN = "email";
    public static final String DEFAULT_OUTPUT_DIRECTORY = "outcomes";

    public ImporterOptions {
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("column must not be blank");
        }
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be positive: " + workers);
        }
        if (outputDirectory == null) {
            outputDirectory = "";
        }
    }

    /**
     * Defaults, overridable through {@code customerimporter.column}, {@code customerimporter.workers}
     * and {@code customerimporter.outputDir} system properties.
     */
    public static ImporterOptions defaults() {
        String column = System.getProperty("customerimporter.column", DEFAULT_COLUMN);
        String outputDirectory = System.getProperty("customerimporter.outputDir", DEFAULT_OUTPUT_DIRECTORY);
        String workers = System.getProperty("customerimporter.workers");
        if (workers == null) {
            return new ImporterOptions(column, defaultWorkers(), outputDirectory);
        }
        try {
            return new ImporterOptions(column, Integer.parseInt(workers.trim()), outputDirectory);
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for customerimporter.workers: " + workers, e);
        }
    }

    public static int defaultWorkers() {
        return Runtime.getRuntime().availableProcessors() * 2;
    }

    public ImporterOptions withColumn(String column) {
        return new ImporterOptions(column, workers, outputDirectory);
    }

    public ImporterOptions withWorkers(int workers) {
        return new ImporterOptions(column, workers, outputDirectory);
    }
}
