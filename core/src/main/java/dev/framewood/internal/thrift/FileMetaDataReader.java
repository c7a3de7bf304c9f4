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

import dev.framewood.metadata.FileMetaData;
import dev.framewood.metadata.TreeMetaData;

import static dev.framewood.internal.thrift.ThriftCompactReader.TYPE_BINARY;
import static dev.framewood.internal.thrift.ThriftCompactReader.TYPE_I32;
import static dev.framewood.internal.thrift.ThriftCompactReader.TYPE_LIST;

/**
 * Reader for the file footer ({@link FileMetaData}) from Thrift Compact Protocol.
 */
public class FileMetaDataReader {

    public static FileMetaData read(ThriftCompactReader reader) throws IOException {
        reader.resetLastFieldId();

        int version = 0;
        List<TreeMetaData> trees = new ArrayList<>();
        String createdBy = null;

        while (true) {
            ThriftCompactReader.FieldHeader header = reader.readFieldHeader();
            if (header == null) {
                break;
            }

            switch (header.fieldId()) {
                case 1: // version
                    if (header.type() == TYPE_I32) {
                        version = reader.readI32();
                    }
                    else {
                        reader.skipField(header.type());
                    }
                    break;
                case 2: // trees
                    if (header.type() == TYPE_LIST) {
                        ThriftCompactReader.CollectionHeader listHeader = reader.readListHeader();
                        for (int i = 0; i < listHeader.size(); i++) {
                            trees.add(TreeMetaDataReader.read(reader));
                        }
                    }
                    else {
                        reader.skipField(header.type());
                    }
                    break;
                case 3: // created_by (optional)
                    if (header.type() == TYPE_BINARY) {
                        createdBy = reader.readString();
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

        return new FileMetaData(version, trees, createdBy);
    }
}
