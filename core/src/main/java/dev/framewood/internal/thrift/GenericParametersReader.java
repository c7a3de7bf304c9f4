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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import dev.framewood.frame.GenericParameters;

import static dev.framewood.internal.thrift.ThriftCompactReader.TYPE_BINARY;
import static dev.framewood.internal.thrift.ThriftCompactReader.TYPE_LIST;
import static dev.framewood.internal.thrift.ThriftCompactReader.TYPE_MAP;

/**
 * Reader for the per-entry {@link GenericParameters}.
 * <p>
 * Each field is a map from key to a list of values: 1 = ints, 2 = floats (stored as doubles),
 * 3 = doubles, 4 = strings.
 * </p>
 */
public class GenericParametersReader {

    @FunctionalInterface
    private interface ListReader<T> {
        List<T> read(ThriftCompactReader reader) throws IOException;
    }

    public static GenericParameters read(ThriftCompactReader reader) throws IOException {
        reader.resetLastFieldId();

        Map<String, List<Integer>> ints = Map.of();
        Map<String, List<Float>> floats = Map.of();
        Map<String, List<Double>> doubles = Map.of();
        Map<String, List<String>> strings = Map.of();

        while (true) {
            ThriftCompactReader.FieldHeader header = reader.readFieldHeader();
            if (header == null) {
                break;
            }
            if (header.type() != TYPE_MAP) {
                reader.skipField(header.type());
                continue;
            }
            switch (header.fieldId()) {
                case 1 -> ints = readMap(reader, ThriftCompactReader::readI32List);
                case 2 -> floats = readMap(reader, GenericParametersReader::readFloatList);
                case 3 -> doubles = readMap(reader, ThriftCompactReader::readDoubleList);
                case 4 -> strings = readMap(reader, ThriftCompactReader::readStringList);
                default -> reader.skipField(header.type());
            }
        }

        return new GenericParameters(ints, floats, doubles, strings);
    }

    private static <T> Map<String, List<T>> readMap(ThriftCompactReader reader, ListReader<T> valueReader) throws IOException {
        ThriftCompactReader.MapHeader mapHeader = reader.readMapHeader();
        if (mapHeader.size() > 0 && (mapHeader.keyType() != TYPE_BINARY || mapHeader.valueType() != TYPE_LIST)) {
            throw new IOException("Parameter maps must map strings to lists, found key type "
                    + mapHeader.keyType() + " and value type " + mapHeader.valueType());
        }
        Map<String, List<T>> values = new LinkedHashMap<>();
        for (int i = 0; i < mapHeader.size(); i++) {
            String key = reader.readString();
            values.put(key, valueReader.read(reader));
        }
        return values;
    }

    private static List<Float> readFloatList(ThriftCompactReader reader) throws IOException {
        List<Double> widened = reader.readDoubleList();
        List<Float> values = new ArrayList<>(widened.size());
        for (Double value : widened) {
            values.add(value.floatValue());
        }
        return values;
    }
}
