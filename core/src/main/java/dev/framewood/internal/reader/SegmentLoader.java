/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.reader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import dev.framewood.metadata.FileMetaData;
import dev.framewood.reader.FramewoodContext;

/**
 * Opens the segments of a dataset: maps each file and parses its footer.
 * <p>
 * With more than one file and parallel opening enabled on the context, files are mapped and parsed
 * concurrently on the context's executor. The resulting list is always in the order of the given
 * paths.
 * </p>
 */
public final class SegmentLoader {

    private static final System.Logger LOG = System.getLogger(SegmentLoader.class.getName());

    private SegmentLoader() {
    }

    public static List<SegmentState> loadAll(List<Path> paths, FramewoodContext context) throws IOException {
        if (paths.isEmpty()) {
            throw new IllegalArgumentException("At least one file must be provided");
        }

        if (paths.size() == 1 || !context.parallelOpen()) {
            List<SegmentState> segments = new ArrayList<>(paths.size());
            for (int i = 0; i < paths.size(); i++) {
                segments.add(load(i, paths.get(i)));
            }
            return segments;
        }

        List<CompletableFuture<SegmentState>> futures = new ArrayList<>(paths.size());
        for (int i = 0; i < paths.size(); i++) {
            int index = i;
            futures.add(CompletableFuture.supplyAsync(() -> {
                try {
                    return load(index, paths.get(index));
                }
                catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }, context.executor()));
        }

        List<SegmentState> segments = new ArrayList<>(paths.size());
        for (CompletableFuture<SegmentState> future : futures) {
            try {
                segments.add(future.join());
            }
            catch (CompletionException e) {
                if (e.getCause() instanceof UncheckedIOException io) {
                    throw io.getCause();
                }
                throw e;
            }
        }
        return segments;
    }

    /**
     * Maps the given file and reads its footer. The channel is closed before returning.
     */
    public static SegmentState load(int index, Path path) throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long fileSize = channel.size();
            if (fileSize > Integer.MAX_VALUE) {
                throw new IOException("File too large to map (" + fileSize + " bytes): " + path);
            }
            MappedByteBuffer mapping = channel.map(FileChannel.MapMode.READ_ONLY, 0, fileSize);
            FileMetaData metaData = FooterReader.readMetadata(mapping, path.toString());

            LOG.log(System.Logger.Level.DEBUG, "Opened segment {0}: {1} with {2} trees",
                    index, path, metaData.trees().size());

            return new SegmentState(index, path.toString(), mapping, metaData);
        }
    }

    /**
     * Wraps an in-memory buffer holding a complete frame file as a single segment.
     */
    public static SegmentState load(ByteBuffer buffer) throws IOException {
        ByteBuffer data = buffer.slice().asReadOnlyBuffer();
        FileMetaData metaData = FooterReader.readMetadata(data, "<memory>");
        LOG.log(System.Logger.Level.DEBUG, "Opened in-memory segment with {0} trees", metaData.trees().size());
        return new SegmentState(0, "<memory>", data, metaData);
    }
}
