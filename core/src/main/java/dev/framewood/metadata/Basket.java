/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.metadata;

/**
 * Location of one compressed block of consecutive column entries.
 *
 * @param firstEntry the first (segment-local) entry stored in this basket
 * @param numEntries the number of entries stored in this basket
 * @param dataOffset absolute offset of the compressed block within the file
 * @param compressedSize size of the block on disk
 * @param uncompressedSize size of the block after decompression
 */
public record Basket(
        long firstEntry,
        int numEntries,
        long dataOffset,
        int compressedSize,
        int uncompressedSize) {

    /**
     * Whether the given segment-local entry is stored in this basket.
     */
    public boolean contains(long entry) {
        return entry >= firstEntry && entry < firstEntry + numEntries;
    }
}
