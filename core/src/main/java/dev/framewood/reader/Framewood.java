/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.reader;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Entry point for reading frame files with a shared thread pool.
 *
 * <p>Use this when opening several datasets to share the executor across readers:</p>
 * <pre>{@code
 * try (Framewood framewood = Framewood.create()) {
 *     FrameReader run1 = framewood.openAll(List.of(part1, part2));
 *     FrameReader run2 = framewood.open(path);
 *     // ...
 * }
 * }</pre>
 *
 * <p>For standalone usage, {@link FrameReader#open(Path)} is simpler.</p>
 */
public class Framewood implements AutoCloseable {

    private final FramewoodContext context;

    private Framewood(FramewoodContext context) {
        this.context = context;
    }

    /**
     * Create a new Framewood instance with a thread pool sized to available processors.
     */
    public static Framewood create() {
        return new Framewood(FramewoodContext.create());
    }

    /**
     * Create a new Framewood instance with a thread pool of the specified size.
     */
    public static Framewood create(int threads) {
        return new Framewood(FramewoodContext.create(threads));
    }

    /**
     * Open a single frame file for reading.
     */
    public FrameReader open(Path path) throws IOException {
        return FrameReader.open(List.of(path), context);
    }

    /**
     * Open a chain of frame files that together form one dataset.
     * <p>
     * The entries of each category are numbered across all files, in the order of the given list.
     * Files are opened concurrently on this instance's executor unless disabled via the
     * {@code framewood.parallelopen} system property.
     * </p>
     *
     * @param paths the files to read (must not be empty)
     * @return a reader over all files
     * @throws IOException if any file cannot be opened or read
     * @throws IllegalArgumentException if the paths list is empty
     */
    public FrameReader openAll(List<Path> paths) throws IOException {
        return FrameReader.open(paths, context);
    }

    /**
     * Open a complete frame file held in memory.
     */
    public FrameReader open(ByteBuffer buffer) throws IOException {
        return FrameReader.open(buffer, context);
    }

    /**
     * Get the executor service used by this instance.
     */
    public ExecutorService executor() {
        return context.executor();
    }

    @Override
    public void close() {
        context.close();
    }
}
