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

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Read-only view over the bytes of a whole input file.
 * <p>
 * The file is mapped in regions of 1 GiB so that offsets are {@code long} and inputs beyond
 * {@link Integer#MAX_VALUE} bytes work. Only absolute reads are used, so a single instance can be
 * shared by all workers without synchronization.
 */
public final class SourceBuffer implements Closeable {

    private static final int REGION_SHIFT = 30;
    private static final long REGION_SIZE = 1L << REGION_SHIFT;

    private final ByteBuffer[] regions;
    private final int regionShift;
    private final long regionMask;
    private final long size;
    private final FileChannel channel;

    private SourceBuffer(ByteBuffer[] regions, int regionShift, long size, FileChannel channel) {
        this.regions = regions;
        this.regionShift = regionShift;
        this.regionMask = (1L << regionShift) - 1;
        this.size = size;
        this.channel = channel;
    }

    public static SourceBuffer map(Path path) throws IOException {
        FileChannel channel;
        try {
            channel = FileChannel.open(path, StandardOpenOption.READ);
        }
        catch (IOException e) {
            throw new IOException("Failed to open CSV file: " + path, e);
        }

        try {
            long size = channel.size();
            int regionCount = (int) ((size + REGION_SIZE - 1) >>> REGION_SHIFT);
            ByteBuffer[] regions = new ByteBuffer[regionCount];
            for (int i = 0; i < regionCount; i++) {
                long offset = (long) i << REGION_SHIFT;
                regions[i] = channel.map(FileChannel.MapMode.READ_ONLY, offset, Math.min(REGION_SIZE, size - offset));
            }
            return new SourceBuffer(regions, REGION_SHIFT, size, channel);
        }
        catch (IOException e) {
            try {
                channel.close();
            }
            catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw new IOException("Failed to map CSV file: " + path, e);
        }
    }

    public static SourceBuffer wrap(byte[] bytes) {
        return wrap(bytes, REGION_SHIFT);
    }

    /**
     * Splits {@code bytes} into regions of {@code 1 << regionShift} bytes, the layout {@link #map}
     * uses for large files.
     */
    static SourceBuffer wrap(byte[] bytes, int regionShift) {
        int regionSize = 1 << regionShift;
        int regionCount = (int) ((bytes.length + (long) regionSize - 1) >>> regionShift);
        ByteBuffer[] regions = new ByteBuffer[regionCount];
        for (int i = 0; i < regionCount; i++) {
            int offset = i << regionShift;
            regions[i] = ByteBuffer.wrap(bytes, offset, Math.min(regionSize, bytes.length - offset)).slice().asReadOnlyBuffer();
        }
        return new SourceBuffer(regions, regionShift, bytes.length, null);
    }

    public static SourceBuffer wrap(String text) {
        return wrap(text.getBytes(StandardCharsets.UTF_8));
    }

    public long size() {
        return size;
    }

    public byte get(long offset) {
        return regions[(int) (offset >>> regionShift)].get((int) (offset & regionMask));
    }

    public String toString(long start, long end) {
        byte[] bytes = new byte[Math.toIntExact(end - start)];
        for (int i = 0; i < bytes.length; i++) {
            bytes[i] = get(start + i);
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public void close() throws IOException {
        if (channel != null) {
            channel.close();
        }
    }
}
