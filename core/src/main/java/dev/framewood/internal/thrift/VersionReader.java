/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.thrift;

import java.io.IOException;

import dev.framewood.metadata.Version;

import static dev.framewood.internal.thrift.ThriftCompactReader.TYPE_I32;

/**
 * Reader for the build {@link Version} recorded in the metadata tree.
 */
public class VersionReader {

    public static Version read(ThriftCompactReader reader) throws IOException {
        reader.resetLastFieldId();

        int major = 0;
        int minor = 0;
        int patch = 0;

        while (true) {
            ThriftCompactReader.FieldHeader header = reader.readFieldHeader();
            if (header == null) {
                break;
            }
            if (header.type() != TYPE_I32) {
                reader.skipField(header.type());
                continue;
            }
            switch (header.fieldId()) {
                case 1 -> major = reader.readI32();
                case 2 -> minor = reader.readI32();
                case 3 -> patch = reader.readI32();
                default -> reader.skipField(header.type());
            }
        }

        return new Version(major, minor, patch);
    }
}
