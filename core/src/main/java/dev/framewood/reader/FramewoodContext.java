/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.reader;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import dev.framewood.internal.compression.DecompressorFactory;

/**
 * Context object that manages shared resources for frame file reading.
 * <p>
 * Holds the thread pool used for opening the segments of a multi-file dataset in parallel, and the
 * decompressor factory.
 * </p>
 * <p>
 * The context lifecycle is tied to either:
 * <ul>
 *   <li>{@link Framewood} instance (for sharing across readers)</li>
 *   <li>{@link FrameReader} instance (for standalone usage)</li>
 * </ul>
 * </p>
 */
public final class FramewoodContext implements AutoCloseable {

    static final String PARALLEL_OPEN_PROPERTY = "framewood.parallelopen";

    private static final System.Logger LOG = System.getLogger(FramewoodContext.class.getName());

    private final ExecutorService executor;
    private final DecompressorFactory decompressorFactory;
    private final boolean parallelOpen;

    private FramewoodContext(ExecutorService executor, boolean parallelOpen) {
        this.executor = executor;
        this.decompressorFactory = new DecompressorFactory();
        this.parallelOpen = parallelOpen;
    }

    /**
     * Create a new context with a thread pool sized to available processors.
     */
    public static FramewoodContext create() {
        return create(Runtime.getRuntime().availableProcessors());
    }

    /**
     * Create a new context with a thread pool of the specified size.
     */
    public static FramewoodContext create(int threads) {
        AtomicInteger threadCounter = new AtomicInteger(0);
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "framewood-" + threadCounter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        ExecutorService executor = Executors.newFixedThreadPool(threads, threadFactory);

        boolean parallelOpen = !"false".equalsIgnoreCase(System.getProperty(PARALLEL_OPEN_PROPERTY));
        if (!parallelOpen) {
            LOG.log(System.Logger.Level.DEBUG, "Parallel segment opening disabled via system property");
        }
        return new FramewoodContext(executor, parallelOpen);
    }

    /**
     * Get the executor service for parallel operations.
     */
    public ExecutorService executor() {
        return executor;
    }

    /**
     * Get the decompressor factory.
     */
    public DecompressorFactory decompressorFactory() {
        return decompressorFactory;
    }

    /**
     * Whether the segments of a multi-file dataset are opened concurrently.
     */
    public boolean parallelOpen() {
        return parallelOpen;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
