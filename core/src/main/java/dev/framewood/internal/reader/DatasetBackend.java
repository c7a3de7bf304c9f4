/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.reader;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import dev.framewood.internal.compression.DecompressorFactory;
import dev.framewood.metadata.TreeMetaData;

/**
 * The storage backend of a reader: all opened segments, from which logical trees are chained on
 * request.
 * <p>
 * Shared read-only by all categories. The set of segments is fixed at construction.
 * </p>
 */
public class DatasetBackend {

    private static final System.Logger LOG = System.getLogger(DatasetBackend.class.getName());

    private final List<SegmentState> segments;
    private final DecompressorFactory decompressorFactory;

    public DatasetBackend(List<SegmentState> segments, DecompressorFactory decompressorFactory) {
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("At least one segment is required");
        }
        this.segments = List.copyOf(segments);
        this.decompressorFactory = decompressorFactory;
    }

    /**
     * Chains the tree with the given name over all segments.
     *
     * @return the chain, or null if no segment contains a tree of that name
     */
    public TreeChain chain(String treeName) {
        List<String> missingFrom = new ArrayList<>();
        boolean found = false;
        for (SegmentState segment : segments) {
            TreeMetaData tree = segment.fileMetaData().tree(treeName);
            if (tree == null) {
                missingFrom.add(segment.source());
            }
            else {
                found = true;
            }
        }
        if (!found) {
            return null;
        }
        if (!missingFrom.isEmpty()) {
            LOG.log(System.Logger.Level.WARNING, "Tree ''{0}'' is missing from segments {1}; they contribute no entries",
                    treeName, missingFrom);
        }
        return new TreeChain(treeName, segments, decompressorFactory);
    }

    /**
     * Names of all trees found in any segment, in order of first appearance.
     */
    public List<String> treeNames() {
        Set<String> names = new LinkedHashSet<>();
        for (SegmentState segment : segments) {
            for (TreeMetaData tree : segment.fileMetaData().trees()) {
                names.add(tree.name());
            }
        }
        return new ArrayList<>(names);
    }

    public int segmentCount() {
        return segments.size();
    }
}
