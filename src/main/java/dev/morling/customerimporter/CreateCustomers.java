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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;

/**
 * Generates customer CSV files for trying out and benchmarking {@link CustomerImporter}.
 */
public class CreateCustomers {

    private static final Path CUSTOMERS_FILE = Path.of("./customers.csv");
    private static final String USAGE = "Usage: CreateCustomers <number of records to create> [seed] [--unique-domains] [file]";

    static final String HEADER = "first_name,last_name,email,gender,ip_address";
    static final List<String> DOMAINS = List.of(
            "gmail.com", "yahoo.com", "outlook.com", "example.com",
            "protonmail.com", "aol.com", "mail.com", "icloud.com");

    private static final String[] GENDERS = { "Male", "Female" };

    public static void main(String[] args) throws IOException {
        long start = System.currentTimeMillis();

        if (args.length < 1) {
            System.out.println(USAGE);
            System.exit(1);
        }

        int size = 0;
        try {
            size = Integer.parseInt(args[0]);
        }
        catch (NumberFormatException e) {
            System.out.println("Invalid value for <number of records to create>");
            System.out.println(USAGE);
            System.exit(1);
        }

        // Default seed is "customer" in hexadecimal
        long seed = 0x637573746f6d6572L;
        boolean uniqueDomains = false;
        Path file = CUSTOMERS_FILE;
        for (int i = 1; i < args.length; i++) {
            if ("--unique-domains".equals(args[i])) {
                uniqueDomains = true;
            }
            else if (args[i].endsWith(".csv")) {
                file = Path.of(args[i]);
            }
            else {
                try {
                    seed = Long.parseLong(args[i]);
                }
                catch (NumberFormatException e) {
                    System.out.println("Invalid value for [seed]");
                    System.out.println(USAGE);
                    System.exit(1);
                }
            }
        }

        write(file, size, seed, uniqueDomains);
        System.out.printf("Created %s with %,d customers in %s ms%n", file, size, System.currentTimeMillis() - start);
    }

    /**
     * Writes {@code size} customers. With {@code uniqueDomains} every customer gets its own
     * {@code domain<i>.com}, otherwise domains are drawn from {@link #DOMAINS}.
     */
    public static void write(Path file, int size, long seed, boolean uniqueDomains) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        Random random = new Random(seed);
        try (BufferedWriter bw = Files.newBufferedWriter(file)) {
            bw.write(HEADER);
            bw.write('\n');
            for (int i = 0; i < size; i++) {
                String domain = uniqueDomains ? "domain" + i + ".com" : DOMAINS.get(random.nextInt(DOMAINS.size()));
                bw.write("First");
                bw.write(Integer.toString(i));
                bw.write(",Last");
                bw.write(Integer.toString(i));
                bw.write(",user");
                bw.write(Integer.toString(i));
                bw.write('@');
                bw.write(domain);
                bw.write(',');
                bw.write(uniqueDomains ? GENDERS[i % 2] : GENDERS[random.nextInt(2)]);
                bw.write(',');
                bw.write(uniqueDomains ? ipAddress(i) : ipAddress(random.nextInt()));
                bw.write('\n');
            }
        }
    }

    private static String ipAddress(int value) {
        return (value & 0xff) + "." + ((value >>> 8) & 0xff) + "." + ((value >>> 16) & 0xff) + "." + ((value >>> 24) & 0xff);
    }
}
