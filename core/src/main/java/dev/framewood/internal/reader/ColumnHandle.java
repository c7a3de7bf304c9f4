/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.reader;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

import dev.framewood.frame.ObjectID;
import dev.framewood.internal.compression.Decompressor;
import dev.framewood.metadata.Basket;
import dev.framewood.metadata.ColumnMetaData;

/**
 * Resolved handle on one column of one tree within one segment.
 * <p>
 * Entry values are read basket by basket; the most recently decompressed basket is kept so that
 * consecutive entries of the same basket are served without decompressing again. A decompressed
 * basket starts with {@code numEntries + 1} little endian int32 offsets into the value area that
 * follows them.
 * </p>
 * <p>
 * A handle is only valid for the segment it was resolved against.
 * </p>
 */
public class ColumnHandle {

    private static final System.Logger LOG = System.getLogger(ColumnHandle.class.getName());

    private static final ByteBuffer EMPTY = ByteBuffer.allocate(0).order(ByteOrder.LITTLE_ENDIAN);

    private final SegmentState segment;
    private final ColumnMetaData column;
    private final Decompressor decompressor;

    private int currentBasketIndex = -1;
    private ByteBuffer currentBasket;

    public ColumnHandle(SegmentState segment, ColumnMetaData column, Decompressor decompressor) {
        this.segment = segment;
        this.column = column;
        this.decompressor = decompressor;
    }

    /**
     * Returns the value stored for the given segment-local entry as a read-only little endian
     * buffer. Entries not stored in any basket yield an empty buffer.
     */
    public ByteBuffer read(long localEntry) throws IOException {
        int basketIndex = findBasket(localEntry);
        if (basketIndex < 0) {
            return EMPTY.duplicate().order(ByteOrder.LITTLE_ENDIAN);
        }
        Basket basket = column.baskets().get(basketIndex);
        ByteBuffer decompressed = loadBasket(basketIndex, basket);

        int slot = (int) (localEntry - basket.firstEntry());
        int valuesStart = (basket.numEntries() + 1) * Integer.BYTES;
        int start = decompressed.getInt(slot * Integer.BYTES);
        int end = decompressed.getInt((slot + 1) * Integer.BYTES);
        if (start < 0 || end < start || valuesStart + end > decompressed.limit()) {
            throw new IOException("Corrupt basket offsets for entry " + localEntry + " of column '" + column.name()
                    + "' in " + segment.source() + ": [" + start + ", " + end + ")");
        }
        return decompressed.slice(valuesStart + start, end - start).asReadOnlyBuffer().order(ByteOrder.LITTLE_ENDIAN);
    }

    /**
     * Reads the value of the given entry as a sequence of packed object IDs.
     */
    public List<ObjectID> readObjectIDs(long localEntry) throws IOException {
        ByteBuffer value = read(localEntry);
        if (value.remaining() % ObjectID.BYTES != 0) {
            throw new IOException("Relation value of column '" + column.name() + "' has " + value.remaining()
                    + " bytes, not a multiple of " + ObjectID.BYTES);
        }
        List<ObjectID> ids = new ArrayList<>(value.remaining() / ObjectID.BYTES);
        while (value.hasRemaining()) {
            ids.add(new ObjectID(value.getInt(), value.getInt()));
        }
        return ids;
    }

    private int findBasket(long localEntry) {
        List<Basket> baskets = column.baskets();
        int low = 0;
        int high = baskets.size() - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            Basket basket = baskets.get(mid);
            if (basket.contains(localEntry)) {
                return mid;
            }
            if (localEntry < basket.firstEntry()) {
                high = mid - 1;
            }
            else {
                low = mid + 1;
            }
        }
        return -1;
    }

    private ByteBuffer loadBasket(int basketIndex, Basket basket) throws IOException {
        if (basketIndex == currentBasketIndex) {
            return currentBasket;
        }

        ByteBuffer compressed = segment.data().slice((int) basket.dataOffset(), basket.compressedSize());
        byte[] bytes = decompressor.decompress(compressed, basket.uncompressedSize());
        if (bytes.length < (basket.numEntries() + 1) * Integer.BYTES) {
            throw new IOException("Basket of column '" + column.name() + "' in " + segment.source()
                    + " is too small for its " + basket.numEntries() + " entry offsets");
        }

        LOG.log(System.Logger.Level.TRACE, "Loaded basket {0} of column {1} in segment {2} ({3} -> {4} bytes, {5})",
                basketIndex, column.name(), segment.index(), basket.compressedSize(), basket.uncompressedSize(),
                decompressor.getName());

        currentBasket = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        currentBasketIndex = basketIndex;
        return currentBasket;
    }
}
