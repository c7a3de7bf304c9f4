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

import dev.framewood.frame.FrameData;
import dev.framewood.internal.reader.CategoryRegistry;
import dev.framewood.internal.reader.CategoryState;
import dev.framewood.internal.reader.DatasetBackend;
import dev.framewood.internal.reader.FrameAssembler;
import dev.framewood.internal.reader.MetadataDecoder;
import dev.framewood.internal.reader.SegmentLoader;
import dev.framewood.internal.reader.SegmentState;
import dev.framewood.metadata.Version;

/**
 * Reader for the frames of a dataset made of one or more chained frame files.
 * <p>
 * Each category (for instance "events" or "runs") is read independently, either sequentially with
 * {@link #readNextEntry(String)} or by index with {@link #readEntry(String, long)}. Reads of a
 * category that does not exist, or past its last entry, return {@code null}.
 * </p>
 *
 * <pre>{@code
 * try (FrameReader reader = FrameReader.open(path)) {
 *     FrameData frame;
 *     while ((frame = reader.readNextEntry("events")) != null) {
 *         // ...
 *     }
 * }
 * }</pre>
 *
 * <p>Not thread-safe. For sharing a thread pool across readers, use {@link Framewood}.</p>
 */
public class FrameReader implements AutoCloseable {

    private static final System.Logger LOG = System.getLogger(FrameReader.class.getName());

    private final DatasetBackend backend;
    private final MetadataDecoder decoder;
    private final CategoryRegistry categories;
    private final FrameAssembler assembler;
    private final FramewoodContext context;
    private final boolean ownsContext;
    private boolean closed;

    private FrameReader(DatasetBackend backend, MetadataDecoder decoder, FramewoodContext context, boolean ownsContext) {
        this.backend = backend;
        this.decoder = decoder;
        this.categories = new CategoryRegistry(backend, decoder);
        this.assembler = new FrameAssembler();
        this.context = context;
        this.ownsContext = ownsContext;
    }

    /**
     * Open a frame file with a dedicated context.
     * The context is closed when this reader is closed.
     */
    public static FrameReader open(Path path) throws IOException {
        return openAll(List.of(path));
    }

    /**
     * Open a chain of frame files with a dedicated context.
     * The context is closed when this reader is closed.
     *
     * @throws IllegalArgumentException if the paths list is empty
     */
    public static FrameReader openAll(List<Path> paths) throws IOException {
        if (paths.isEmpty()) {
            throw new IllegalArgumentException("At least one file must be provided");
        }
        FramewoodContext context = FramewoodContext.create();
        try {
            return create(SegmentLoader.loadAll(paths, context), context, true);
        }
        catch (IOException | RuntimeException e) {
            context.close();
            throw e;
        }
    }

    /**
     * Open a complete frame file held in memory, with a dedicated context.
     */
    public static FrameReader open(ByteBuffer buffer) throws IOException {
        FramewoodContext context = FramewoodContext.create(1);
        try {
            return create(List.of(SegmentLoader.load(buffer)), context, true);
        }
        catch (IOException | RuntimeException e) {
            context.close();
            throw e;
        }
    }

    /**
     * Open a chain of frame files with a shared context.
     * The context is NOT closed when this reader is closed.
     */
    static FrameReader open(List<Path> paths, FramewoodContext context) throws IOException {
        return create(SegmentLoader.loadAll(paths, context), context, false);
    }

    /**
     * Open an in-memory frame file with a shared context.
     * The context is NOT closed when this reader is closed.
     */
    static FrameReader open(ByteBuffer buffer, FramewoodContext context) throws IOException {
        return create(List.of(SegmentLoader.load(buffer)), context, false);
    }

    private static FrameReader create(List<SegmentState> segments, FramewoodContext context, boolean ownsContext)
            throws IOException {
        DatasetBackend backend = new DatasetBackend(segments, context.decompressorFactory());
        MetadataDecoder decoder = MetadataDecoder.open(backend);
        LOG.log(System.Logger.Level.DEBUG, "Opened dataset of {0} segments, version {1}, categories {2}",
                segments.size(), decoder.fileVersion(), decoder.availableCategories());
        return new FrameReader(backend, decoder, context, ownsContext);
    }

    /**
     * Reads the next entry of the given category.
     * <p>
     * The first call returns entry 0; after {@link #readEntry(String, long)} returned entry
     * {@code k}, the next call returns entry {@code k + 1}.
     * </p>
     *
     * @return the frame, or {@code null} if the category does not exist or has no further entries
     * @throws MetadataInconsistencyException if the category's metadata is inconsistent
     * @throws IOException if the data cannot be read
     */
    public FrameData readNextEntry(String category) throws IOException {
        checkOpen();
        CategoryState state = categories.getOrInit(category);
        return assembler.readNext(state);
    }

    /**
     * Reads the given entry of the given category. Entries are numbered across all files.
     *
     * @return the frame, or {@code null} if the category does not exist or has no such entry
     * @throws IllegalArgumentException if {@code entry} is negative
     * @throws MetadataInconsistencyException if the category's metadata is inconsistent
     * @throws IOException if the data cannot be read
     */
    public FrameData readEntry(String category, long entry) throws IOException {
        if (entry < 0) {
            throw new IllegalArgumentException("Entry index must not be negative: " + entry);
        }
        checkOpen();
        CategoryState state = categories.getOrInit(category);
        return assembler.readAt(state, entry);
    }

    /**
     * Number of entries of the given category over all files, 0 if it does not exist.
     */
    public long getEntries(String category) {
        checkOpen();
        return categories.entryCount(category);
    }

    /**
     * Categories for which collection metadata is stored.
     */
    public List<String> getAvailableCategories() {
        checkOpen();
        return decoder.availableCategories();
    }

    /**
     * Version of the software that wrote the dataset; 0.0.0 if not recorded.
     */
    public Version currentFileVersion() {
        checkOpen();
        return decoder.fileVersion();
    }

    /**
     * JSON definition of the named datamodel, or {@code "{}"} if none is stored under that name.
     */
    public String getDatamodelDefinition(String name) {
        checkOpen();
        return decoder.datamodelDefinitions().getDatamodelDefinition(name);
    }

    public List<String> getAvailableDatamodels() {
        checkOpen();
        return decoder.datamodelDefinitions().getAvailableDatamodels();
    }

    public int getSegmentCount() {
        checkOpen();
        return backend.segmentCount();
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Reader is closed");
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (ownsContext) {
            context.close();
        }
    }
}
