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

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Reads a customer CSV file and writes the number of customers per e-mail domain, sorted by count
 * descending and domain ascending.
 * <p>
 * The file is memory mapped once and its body split into line-aligned segments, one per worker.
 * Workers count into private tables which are merged after all of them completed.
 */
public final class CustomerImporter {

    private CustomerImporter() {
    }

    public static void main(String[] args) {
        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args) {
        Path input;
        ImporterOptions options;
        try {
            Arguments arguments = Arguments.parse(args);
            if (arguments.help() || !arguments.hasFile()) {
                Arguments.printUsage(System.out);
                return arguments.help() ? 0 : 2;
            }
            input = arguments.csvPath();
            options = arguments.options(ImporterOptions.defaults());
        }
        catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return 2;
        }

        System.out.printf("Processing CSV file: %s%n", input);
        try {
            ImportSummary summary = process(input, OutputPaths.derive(input, options.outputDirectory()), options);
            System.out.printf("Counted %,d of %,d rows into %,d domains (%,d rows skipped)%n",
                    summary.counted(), summary.rows(), summary.domains(), summary.skipped());
            System.out.printf("Processing completed in: %d ms%n", summary.elapsedMillis());
            return 0;
        }
        catch (IOException | SchemaException e) {
            System.err.println("Error processing CSV file: " + e.getMessage());
            return 1;
        }
    }

    public static ImportSummary process(Path input) throws IOException, SchemaException {
        ImporterOptions options = ImporterOptions.defaults();
        return process(input, OutputPaths.derive(input, options.outputDirectory()), options);
    }

    public static ImportSummary process(Path input, Path output, ImporterOptions options) throws IOException, SchemaException {
        long start = System.currentTimeMillis();

        List<PartialCounts> partials;
        try (SourceBuffer buffer = SourceBuffer.map(input)) {
            Header header;
            try {
                header = RecordSplitter.locateHeader(buffer, options.column());
            }
            catch (SchemaException e) {
                throw new SchemaException(input + ": " + e.getMessage(), e);
            }
            List<Segment> segments = RecordSplitter.partition(buffer, header.bodyStart(), options.workers());
            partials = aggregate(input, buffer, header.columnIndex(), segments);
        }

        Map<String, Long> counts = DomainRanking.merge(partials);
        List<DomainCount> ranked = DomainRanking.rank(counts);
        ResultWriter.write(output, ranked);
        System.out.printf("Results written to: %s%n", output);

        long rows = 0;
        long skipped = 0;
        for (PartialCounts partial : partials) {
            rows += partial.rows();
            skipped += partial.skipped();
        }
        return new ImportSummary(output, ranked.size(), rows, skipped, System.currentTimeMillis() - start);
    }

    static List<PartialCounts> aggregate(Path input, SourceBuffer buffer, int columnIndex, List<Segment> segments) throws IOException {
        if (segments.isEmpty()) {
            return List.of();
        }

        List<Callable<PartialCounts>> tasks = new ArrayList<>(segments.size());
        for (Segment segment : segments) {
            tasks.add(() -> new SegmentAggregator(buffer, columnIndex).aggregate(segment));
        }

        ExecutorService executor = Executors.newFixedThreadPool(segments.size());
        try {
            List<PartialCounts> partials = new ArrayList<>(segments.size());
            for (Future<PartialCounts> future : executor.invokeAll(tasks)) {
                partials.add(future.get());
            }
            return partials;
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while aggregating " + input, e);
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IOException("Failed to aggregate " + input + ": " + cause, cause);
        }
        finally {
            executor.shutdownNow();
        }
    }
}
