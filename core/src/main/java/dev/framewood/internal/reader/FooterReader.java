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
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import dev.framewood.internal.thrift.FileMetaDataReader;
import dev.framewood.internal.thrift.ThriftCompactReader;
import dev.framewood.metadata.Basket;
import dev.framewood.metadata.ColumnMetaData;
import dev.framewood.metadata.FileMetaData;
import dev.framewood.metadata.TreeMetaData;

/**
 * Reads and validates the footer of a frame file.
 * <p>
 * Layout: {@code "FWD1" | basket data | footer | footer length (int32 LE) | "FWD1"}.
 * </p>
 */
public final class FooterReader {

    static final byte[] MAGIC = "FWD1".getBytes(StandardCharsets.US_ASCII);
    private static final int FOOTER_LENGTH_SIZE = 4;
    private static final int MAGIC_SIZE = 4;

    private FooterReader() {
        // Utility class
    }

    /**
     * Reads the file metadata from a buffer covering an entire file.
     *
     * @param data the complete file contents
     * @param source description of the file, used in error messages
     * @return the parsed and validated metadata
     * @throws IOException if the buffer does not hold a valid frame file
     */
    public static FileMetaData readMetadata(ByteBuffer data, String source) throws IOException {
        int fileSize = data.limit();
        if (fileSize < MAGIC_SIZE + MAGIC_SIZE + FOOTER_LENGTH_SIZE) {
            throw new IOException("File too small to be a frame file: " + source);
        }

        byte[] startMagic = new byte[MAGIC_SIZE];
        data.get(0, startMagic);
        if (!Arrays.equals(startMagic, MAGIC)) {
            throw new IOException("Not a frame file (invalid magic number at start): " + source);
        }

        int footerInfoPos = fileSize - MAGIC_SIZE - FOOTER_LENGTH_SIZE;
        ByteBuffer footerInfo = data.slice(footerInfoPos, FOOTER_LENGTH_SIZE + MAGIC_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        int footerLength = footerInfo.getInt();
        byte[] endMagic = new byte[MAGIC_SIZE];
        footerInfo.get(endMagic);
        if (!Arrays.equals(endMagic, MAGIC)) {
            throw new IOException("Not a frame file (invalid magic number at end): " + source);
        }

        int footerStart = footerInfoPos - footerLength;
        if (footerLength < 0 || footerStart < MAGIC_SIZE) {
            throw new IOException("Invalid footer length " + footerLength + " in " + source);
        }

        FileMetaData metaData = FileMetaDataReader.read(new ThriftCompactReader(data.slice(footerStart, footerLength)));
        validateBaskets(metaData, footerStart, source);
        return metaData;
    }

    private static void validateBaskets(FileMetaData metaData, int dataEnd, String source) throws IOException {
        for (TreeMetaData tree : metaData.trees()) {
            for (ColumnMetaData column : tree.columns()) {
                long nextEntry = 0;
                for (Basket basket : column.baskets()) {
                    if (basket.dataOffset() < MAGIC_SIZE || basket.dataOffset() + basket.compressedSize() > dataEnd) {
                        throw new IOException("Basket of column '" + tree.name() + "/" + column.name()
                                + "' lies outside the data region of " + source);
                    }
                    if (basket.firstEntry() < 0 || basket.firstEntry() + basket.numEntries() > tree.numEntries()) {
                        throw new IOException("Basket of column '" + tree.name() + "/" + column.name()
                                + "' covers entries beyond the tree's " + tree.numEntries() + " entries in " + source);
                    }
                    // baskets are looked up by binary search
                    if (basket.firstEntry() < nextEntry) {
                        throw new IOException("Baskets of column '" + tree.name() + "/" + column.name()
                                + "' are unsorted or overlap at entry " + basket.firstEntry() + " in " + source);
                    }
                    nextEntry = basket.firstEntry() + basket.numEntries();
                }
            }
        }
    }
}
