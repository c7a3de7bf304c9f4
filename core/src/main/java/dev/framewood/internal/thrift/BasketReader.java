/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.thrift;

import java.io.IOException;

import dev.framewood.metadata.Basket;

import static dev.framewood.internal.thrift.ThriftCompactReader.TYPE_I32;
import static dev.framewood.internal.thrift.ThriftCompactReader.TYPE_I64;

/**
 * Reader for Basket from Thrift Compact Protocol.
 */
public class BasketReader {

    public static Basket read(ThriftCompactReader reader) throws IOException {
        short saved = reader.pushFieldIdContext();
        try {
            return readInternal(reader);
        }
        finally {
            reader.popFieldIdContext(saved);
        }
    }

    private static Basket readInternal(ThriftCompactReader reader) throws IOException {
        long firstEntry = 0;
        int numEntries = 0;
        long dataOffset = -1;
        int compressedSize = 0;
        int uncompressedSize = 0;

        while (true) {
            ThriftCompactReader.FieldHeader header = reader.readFieldHeader();
            if (header == null) {
                break;
            }

            switch (header.fieldId()) {
                case 1 -> firstEntry = readI64(reader, header);
                case 2 -> numEntries = readI32(reader, header);
                case 3 -> dataOffset = readI64(reader, header);
                case 4 -> compressedSize = readI32(reader, header);
                case 5 -> uncompressedSize = readI32(reader, header);
                default -> reader.skipField(header.type());
            }
        }

        if (dataOffset < 0 || numEntries < 0 || compressedSize < 0 || uncompressedSize < 0) {
            throw new IOException("Invalid basket: offset=" + dataOffset + ", entries=" + numEntries
                    + ", compressed=" + compressedSize + ", uncompressed=" + uncompressedSize);
        }
        return new Basket(firstEntry, numEntries, dataOffset, compressedSize, uncompressedSize);
    }

    private static long readI64(ThriftCompactReader reader, ThriftCompactReader.FieldHeader header) throws IOException {
        if (header.type() != TYPE_I64) {
            throw new IOException("Basket field " + header.fieldId() + " has unexpected type " + header.type());
        }
        return reader.readI64();
    }

    private static int readI32(ThriftCompactReader reader, ThriftCompactReader.FieldHeader header) throws IOException {
        if (header.type() != TYPE_I32) {
            throw new IOException("Basket field " + header.fieldId() + " has unexpected type " + header.type());
        }
        return reader.readI32();
    }
}
