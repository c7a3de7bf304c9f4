/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.thrift;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import dev.framewood.metadata.Basket;
import dev.framewood.metadata.ColumnMetaData;
import dev.framewood.metadata.CompressionCodec;

import static dev.framewood.internal.thrift.ThriftCompactReader.TYPE_BINARY;
import static dev.framewood.internal.thrift.ThriftCompactReader.TYPE_I32;
import static dev.framewood.internal.thrift.ThriftCompactReader.TYPE_LIST;

/**
 * Reader for ColumnMetaData from Thrift Compact Protocol.
 */
public class ColumnMetaDataReader {

    public static ColumnMetaData read(ThriftCompactReader reader) throws IOException {
        short saved = reader.pushFieldIdContext();
        try {
            return readInternal(reader);
        }
        finally {
            reader.popFieldIdContext(saved);
        }
    }

    private static ColumnMetaData readInternal(ThriftCompactReader reader) throws IOException {
        String name = null;
        CompressionCodec codec = CompressionCodec.UNCOMPRESSED;
        List<Basket> baskets = new ArrayList<>();

        while (true) {
            ThriftCompactReader.FieldHeader header = reader.readFieldHeader();
            if (header == null) {
                break;
            }

            switch (header.fieldId()) {
                case 1: // name
                    if (header.type() == TYPE_BINARY) {
                        name = reader.readString();
                    }
                    else {
                        reader.skipField(header.type());
                    }
                    break;
                case 2: // codec
                    if (header.type() == TYPE_I32) {
                        int codecValue = reader.readI32();
                        try {
                            codec = CompressionCodec.fromThriftValue(codecValue);
                        }
                        catch (IllegalArgumentException e) {
                            throw new IOException("Column '" + name + "' uses an unknown codec", e);
                        }
                    }
                    else {
                        reader.skipField(header.type());
                    }
                    break;
                case 3: // baskets
                    if (header.type() == TYPE_LIST) {
                        ThriftCompactReader.CollectionHeader listHeader = reader.readListHeader();
                        for (int i = 0; i < listHeader.size(); i++) {
                            baskets.add(BasketReader.read(reader));
                        }
                    }
                    else {
                        reader.skipField(header.type());
                    }
                    break;
                default:
                    reader.skipField(header.type());
                    break;
            }
        }

        if (name == null) {
            throw new IOException("Column metadata without a name");
        }
        for (int i = 1; i < baskets.size(); i++) {
            Basket previous = baskets.get(i - 1);
            if (baskets.get(i).firstEntry() < previous.firstEntry() + previous.numEntries()) {
                throw new IOException("Baskets of column '" + name + "' overlap or are out of order at index " + i);
            }
        }
        return new ColumnMetaData(name, codec, baskets);
    }
}
