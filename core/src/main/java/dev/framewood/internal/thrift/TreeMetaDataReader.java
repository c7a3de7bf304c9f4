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

import dev.framewood.metadata.ColumnMetaData;
import dev.framewood.metadata.TreeMetaData;

import static dev.framewood.internal.thrift.ThriftCompactReader.TYPE_BINARY;
import static dev.framewood.internal.thrift.ThriftCompactReader.TYPE_I64;
import static dev.framewood.internal.thrift.ThriftCompactReader.TYPE_LIST;

/**
 * Reader for TreeMetaData from Thrift Compact Protocol.
 */
public class TreeMetaDataReader {

    public static TreeMetaData read(ThriftCompactReader reader) throws IOException {
        short saved = reader.pushFieldIdContext();
        try {
            return readInternal(reader);
        }
        finally {
            reader.popFieldIdContext(saved);
        }
    }

    private static TreeMetaData readInternal(ThriftCompactReader reader) throws IOException {
        String name = null;
        long numEntries = 0;
        List<ColumnMetaData> columns = new ArrayList<>();

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
                case 2: // num_entries
                    if (header.type() == TYPE_I64) {
                        numEntries = reader.readI64();
                    }
                    else {
                        reader.skipField(header.type());
                    }
                    break;
                case 3: // columns
                    if (header.type() == TYPE_LIST) {
                        ThriftCompactReader.CollectionHeader listHeader = reader.readListHeader();
                        for (int i = 0; i < listHeader.size(); i++) {
                            columns.add(ColumnMetaDataReader.read(reader));
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
            throw new IOException("Tree metadata without a name");
        }
        if (numEntries < 0) {
            throw new IOException("Tree '" + name + "' declares a negative entry count: " + numEntries);
        }
        return new TreeMetaData(name, numEntries, columns);
    }
}
