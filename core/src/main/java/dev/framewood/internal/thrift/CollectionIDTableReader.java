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

import static dev.framewood.internal.thrift.ThriftCompactReader.TYPE_LIST;

/**
 * Reader for a category's collection ID table as stored in the metadata tree.
 */
public class CollectionIDTableReader {

    /**
     * The raw id and name lists; their lengths are not validated here.
     */
    public record Entries(List<Integer> ids, List<String> names) {
    }

    public static Entries read(ThriftCompactReader reader) throws IOException {
        reader.resetLastFieldId();

        List<Integer> ids = List.of();
        List<String> names = List.of();

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
                case 1 -> ids = reader.readI32List();
                case 2 -> names = reader.readStringList();
                default -> reader.skipField(header.type());
            }
        }

        return new Entries(ids, names);
    }
}
