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

import dev.framewood.metadata.DatamodelDefinition;

import static dev.framewood.internal.thrift.ThriftCompactReader.TYPE_BINARY;
import static dev.framewood.internal.thrift.ThriftCompactReader.TYPE_LIST;
import static dev.framewood.internal.thrift.ThriftCompactReader.TYPE_STRUCT;

/**
 * Reader for the list of datamodel definitions stored in the metadata tree.
 */
public class DatamodelDefinitionsReader {

    public static List<DatamodelDefinition> read(ThriftCompactReader reader) throws IOException {
        reader.resetLastFieldId();

        List<DatamodelDefinition> definitions = new ArrayList<>();

        while (true) {
            ThriftCompactReader.FieldHeader header = reader.readFieldHeader();
            if (header == null) {
                break;
            }
            if (header.fieldId() == 1 && header.type() == TYPE_LIST) {
                ThriftCompactReader.CollectionHeader listHeader = reader.readListHeader();
                if (listHeader.size() > 0 && listHeader.elementType() != TYPE_STRUCT) {
                    throw new IOException("Expected a list of datamodel definition structs");
                }
                for (int i = 0; i < listHeader.size(); i++) {
                    definitions.add(readDefinition(reader));
                }
            }
            else {
                reader.skipField(header.type());
            }
        }

        return definitions;
    }

    private static DatamodelDefinition readDefinition(ThriftCompactReader reader) throws IOException {
        short saved = reader.pushFieldIdContext();
        try {
            String name = null;
            String definition = null;
            while (true) {
                ThriftCompactReader.FieldHeader header = reader.readFieldHeader();
                if (header == null) {
                    break;
                }
                if (header.type() == TYPE_BINARY && header.fieldId() == 1) {
                    name = reader.readString();
                }
                else if (header.type() == TYPE_BINARY && header.fieldId() == 2) {
                    definition = reader.readString();
                }
                else {
                    reader.skipField(header.type());
                }
            }
            if (name == null || definition == null) {
                throw new IOException("Incomplete datamodel definition entry: name=" + name);
            }
            return new DatamodelDefinition(name, definition);
        }
        finally {
            reader.popFieldIdContext(saved);
        }
    }
}
