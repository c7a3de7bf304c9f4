/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.testing;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import dev.framewood.frame.ObjectID;

import static dev.framewood.internal.thrift.ThriftCompactReader.TYPE_BINARY;
import static dev.framewood.internal.thrift.ThriftCompactReader.TYPE_BOOLEAN_TRUE;
import static dev.framewood.internal.thrift.ThriftCompactReader.TYPE_DOUBLE;
import static dev.framewood.internal.thrift.ThriftCompactReader.TYPE_I32;
import static dev.framewood.internal.thrift.ThriftCompactReader.TYPE_LIST;
import static dev.framewood.internal.thrift.ThriftCompactReader.TYPE_MAP;
import static dev.framewood.internal.thrift.ThriftCompactReader.TYPE_STRUCT;

/**
 * Encoders for the values stored in metadata, relation and parameter columns.
 */
public final class FrameValues {

    private FrameValues() {
    }

    public static byte[] text(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    public static byte[] objectIds(ObjectID... ids) {
        ByteBuffer buffer = ByteBuffer.allocate(ids.length * ObjectID.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (ObjectID id : ids) {
            buffer.putInt(id.index()).putInt(id.collectionID());
        }
        return buffer.array();
    }

    public static byte[] version(int major, int minor, int patch) {
        return new ThriftCompactWriter()
                .fieldHeader(1, TYPE_I32).i32(major)
                .fieldHeader(2, TYPE_I32).i32(minor)
                .fieldHeader(3, TYPE_I32).i32(patch)
                .stop()
                .toByteArray();
    }

    public static byte[] datamodelDefinitions(Map<String, String> definitions) {
        ThriftCompactWriter writer = new ThriftCompactWriter();
        writer.fieldHeader(1, TYPE_LIST).listHeader(TYPE_STRUCT, definitions.size());
        for (Map.Entry<String, String> definition : definitions.entrySet()) {
            writer.beginStruct()
                    .fieldHeader(1, TYPE_BINARY).string(definition.getKey())
                    .fieldHeader(2, TYPE_BINARY).string(definition.getValue())
                    .endStruct();
        }
        return writer.stop().toByteArray();
    }

    public static byte[] idTable(List<Integer> ids, List<String> names) {
        ThriftCompactWriter writer = new ThriftCompactWriter();
        i32List(writer.fieldHeader(1, TYPE_LIST), ids);
        stringList(writer.fieldHeader(2, TYPE_LIST), names);
        return writer.stop().toByteArray();
    }

    /**
     * Collection type information; {@code schemaVersions} may be null to leave the field out.
     */
    public static byte[] collectionTypeInfo(List<String> names, List<String> types, List<Boolean> subset,
                                            List<Integer> schemaVersions) {
        ThriftCompactWriter writer = new ThriftCompactWriter();
        stringList(writer.fieldHeader(1, TYPE_LIST), names);
        stringList(writer.fieldHeader(2, TYPE_LIST), types);
        writer.fieldHeader(3, TYPE_LIST).listHeader(TYPE_BOOLEAN_TRUE, subset.size());
        for (boolean flag : subset) {
            writer.booleanElement(flag);
        }
        if (schemaVersions != null) {
            i32List(writer.fieldHeader(4, TYPE_LIST), schemaVersions);
        }
        return writer.stop().toByteArray();
    }

    public static byte[] parameters(Map<String, List<Integer>> ints, Map<String, List<Double>> floats,
                                    Map<String, List<Double>> doubles, Map<String, List<String>> strings) {
        ThriftCompactWriter writer = new ThriftCompactWriter();
        writer.fieldHeader(1, TYPE_MAP).mapHeader(TYPE_BINARY, TYPE_LIST, ints.size());
        ints.forEach((key, values) -> i32List(writer.string(key), values));
        writer.fieldHeader(2, TYPE_MAP).mapHeader(TYPE_BINARY, TYPE_LIST, floats.size());
        floats.forEach((key, values) -> doubleList(writer.string(key), values));
        writer.fieldHeader(3, TYPE_MAP).mapHeader(TYPE_BINARY, TYPE_LIST, doubles.size());
        doubles.forEach((key, values) -> doubleList(writer.string(key), values));
        writer.fieldHeader(4, TYPE_MAP).mapHeader(TYPE_BINARY, TYPE_LIST, strings.size());
        strings.forEach((key, values) -> stringList(writer.string(key), values));
        return writer.stop().toByteArray();
    }

    private static void i32List(ThriftCompactWriter writer, List<Integer> values) {
        writer.listHeader(TYPE_I32, values.size());
        values.forEach(writer::i32);
    }

    private static void doubleList(ThriftCompactWriter writer, List<Double> values) {
        writer.listHeader(TYPE_DOUBLE, values.size());
        values.forEach(writer::doubleValue);
    }

    private static void stringList(ThriftCompactWriter writer, List<String> values) {
        writer.listHeader(TYPE_BINARY, values.size());
        values.forEach(writer::string);
    }
}
