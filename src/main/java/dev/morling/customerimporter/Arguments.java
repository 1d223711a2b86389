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

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Command line flags of {@link CustomerImporter}. Both {@code -flag=value} and {@code -flag value}
 * are accepted, with one or two leading dashes.
 */
public final class Arguments {

    static final String EXTENSION = ".csv";

    private String file;
    private String column;
    private Integer workers;
    private boolean help;

    private Arguments() {
    }

    public static Arguments parse(String[] args) {
        Arguments arguments = new Arguments();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("-")) {
                if (arguments.file != null) {
                    throw new IllegalArgumentException("Unexpected argument: " + arg);
                }
                arguments.file = arg;
                continue;
            }

            String flag = arg.startsWith("--") ? arg.substring(2) : arg.substring(1);
            String value = null;
            int eq = flag.indexOf('=');
            if (eq >= 0) {
                value = flag.substring(eq + 1);
                flag = flag.substring(0, eq);
            }

            switch (flag) {
                case "help", "h" -> arguments.help = true;
                case "file" -> arguments.file = value != null ? value : next(args, ++i, flag);
                case "column" -> arguments.column = value != null ? value : next(args, ++i, flag);
                case "workers" -> {
                    String workers = value != null ? value : next(args, ++i, flag);
                    try {
                        arguments.workers = Integer.parseInt(workers);
                    }
                    catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid value for -workers: " + workers, e);
                    }
                }
                default -> throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }
        return arguments;
    }

    private static String next(String[] args, int index, String flag) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for -" + flag);
        }
        return args[index];
    }

    public boolean help() {
        return help;
    }

    public boolean hasFile() {
        return file != null && !file.isEmpty();
    }

    /**
     * Returns the input path after checking that it exists and has a {@code .csv} extension.
     */
    public Path csvPath() {
        Path path = Paths.get(file);
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("File does not exist: " + file);
        }
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String extension = dot >= 0 ? name.substring(dot) : "";
        if (!EXTENSION.equals(extension.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("File must have .csv extension, got: " + extension);
        }
        return path;
    }

    public ImporterOptions options(ImporterOptions defaults) {
        ImporterOptions options = defaults;
        if (column != null) {
            options = options.withColumn(column);
        }
        if (workers != null) {
            options = options.withWorkers(workers);
        }
        return options;
    }

    public static void printUsage(PrintStream out) {
        out.println("Customer Domain Counter");
        out.println("=======================");
        out.println("Processes a CSV file and counts e-mail domains.");
        out.println("Results sorted by count (desc) are saved in an output CSV file.");
        out.println();
        out.println("Usage:");
        out.println("  java -jar customer-importer.jar -file=<path_to_csv_file> [options]");
        out.println();
        out.println("Options:");
        out.println("  -file=<path>     CSV file to process (required)");
        out.println("  -column=<name>   header of the e-mail column (default: " + ImporterOptions.DEFAULT_COLUMN + ")");
        out.println("  -workers=<n>     number of parallel workers (default: 2 x available processors)");
        out.println("  -help            show this message");
        out.println();
        out.println("Output:");
        out.println("  Creates a CSV file with '" + OutputPaths.SUFFIX + "' suffix before the extension in the '"
                + ImporterOptions.DEFAULT_OUTPUT_DIRECTORY + "' directory next to the input.");
        out.println("  Example: customers.csv -> " + ImporterOptions.DEFAULT_OUTPUT_DIRECTORY + "/customers_output.csv");
    }
}
