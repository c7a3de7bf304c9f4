/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.reader;

import java.util.ArrayList;
import java.util.List;

import dev.framewood.internal.compression.DecompressorFactory;
import dev.framewood.metadata.ColumnMetaData;
import dev.framewood.metadata.TreeMetaData;

/**
 * One logical tree spread over a chain of segments, exposed as a single contiguous entry space.
 * <p>
 * Global entry indices are translated into a segment and an entry local to that segment. Segments
 * may hold any number of entries, including none; segments that lack the tree contribute no entries.
 * </p>
 */
public class TreeChain {

    /**
     * Position of a global entry within the chain.
     */
    public record Location(int segment, long localEntry) {
    }

    private final String name;
    private final List<SegmentState> segments;
    private final List<TreeMetaData> trees;
    // firstEntries[i] is the global index of the first entry of segment i
    private final long[] firstEntries;
    private final long entryCount;
    private final DecompressorFactory decompressorFactory;

    TreeChain(String name, List<SegmentState> segments, DecompressorFactory decompressorFactory) {
        this.name = name;
        this.segments = segments;
        this.decompressorFactory = decompressorFactory;
        this.trees = new ArrayList<>(segments.size());
        this.firstEntries = new long[segments.size()];

        long total = 0;
        for (int i = 0; i < segments.size(); i++) {
            TreeMetaData tree = segments.get(i).fileMetaData().tree(name);
            trees.add(tree);
            firstEntries[i] = total;
            if (tree != null) {
                total += tree.numEntries();
            }
        }
        this.entryCount = total;
    }

    public String name() {
        return name;
    }

    /**
     * Total number of entries over all segments.
     */
    public long entryCount() {
        return entryCount;
    }

    public int segmentCount() {
        return segments.size();
    }

    /**
     * Returns the location of the given global entry, or null if it is out of range.
     */
    public Location locate(long entry) {
        if (entry < 0 || entry >= entryCount) {
            return null;
        }
        int low = 0;
        int high = firstEntries.length - 1;
        // last segment whose first entry is <= entry and which holds entries
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (firstEntries[mid] <= entry) {
                low = mid;
            }
            else {
                high = mid - 1;
            }
        }
        int segment = low;
        while (entriesIn(segment) == 0 || entry >= firstEntries[segment] + entriesIn(segment)) {
            segment++;
        }
        return new Location(segment, entry - firstEntries[segment]);
    }

    private long entriesIn(int segment) {
        TreeMetaData tree = trees.get(segment);
        return tree == null ? 0 : tree.numEntries();
    }

    /**
     * Names of the columns of this tree in the given segment, in storage order.
     */
    public List<String> columnNames(int segment) {
        TreeMetaData tree = trees.get(segment);
        if (tree == null) {
            return List.of();
        }
        List<String> names = new ArrayList<>(tree.columns().size());
        for (ColumnMetaData column : tree.columns()) {
            names.add(column.name());
        }
        return names;
    }

    public boolean hasColumn(int segment, String columnName) {
        TreeMetaData tree = trees.get(segment);
        return tree != null && tree.column(columnName) != null;
    }

    /**
     * Resolves a handle on the given column in the given segment.
     *
     * @return the handle, or null if the segment's tree has no such column
     */
    public ColumnHandle openColumn(int segment, String columnName) {
        TreeMetaData tree = trees.get(segment);
        if (tree == null) {
            return null;
        }
        ColumnMetaData column = tree.column(columnName);
        if (column == null) {
            return null;
        }
        return new ColumnHandle(segments.get(segment), column, decompressorFactory.getDecompressor(column.codec()));
    }

    public String segmentSource(int segment) {
        return segments.get(segment).source();
    }
}
