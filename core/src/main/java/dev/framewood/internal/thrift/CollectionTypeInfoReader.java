/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.thrift;

import java.io.IOException;
import java.util.List;

import dev.framewood.metadata.CollectionTypeInfo;

import static dev.framewood.internal.thrift.ThriftCompactReader.TYPE_LIST;

/**
 * Reader for a category's {@link CollectionTypeInfo} as stored in the metadata tree.
 * <p>
 * Files written by older versions do not record schema versions; in that case the schema version
 * list is returned as null.
 * </p>
 */
public class CollectionTypeInfoReader {

    public static CollectionTypeInfo read(ThriftCompactReader reader) throws IOException {
        reader.resetLastFieldId();

        List<String> names = List.of();
        List<String> types = List.of();
        List<Boolean> subsetFlags = List.of();
        List<Integer> schemaVersions = null;

        while (true) {
            ThriftCompactReader.FieldHeader header = reader.readFieldHeader();
            if (header == null) {
                break;
            }
            if (header.type() != TYPE_LIST) {
                reader.skipField(header.type());
                continue;
            }
            switch (header.fieldId()) {
                case 1 -> names = reader.readStringList();
                case 2 -> types = reader.readStringList();
                case 3 -> subsetFlags = reader.readBooleanList();
                case 4 -> schemaVersions = reader.readI32List();
                default -> reader.skipField(header.type());
            }
        }

        return new CollectionTypeInfo(names, types, subsetFlags, schemaVersions);
    }
}
