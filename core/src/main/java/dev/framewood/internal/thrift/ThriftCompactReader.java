/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.thrift;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reader for the Thrift Compact Protocol, operating directly on a ByteBuffer.
 * <p>
 * Used for the file footer as well as for the structured values stored in the metadata tree and
 * the per-entry parameters.
 * </p>
 * Reference: https://github.com/apache/thrift/blob/master/doc/specs/thrift-compact-protocol.md
 */
public class ThriftCompactReader {

    public static final byte TYPE_BOOLEAN_TRUE = 0x01;
    public static final byte TYPE_BOOLEAN_FALSE = 0x02;
    public static final byte TYPE_BYTE = 0x03;
    public static final byte TYPE_I16 = 0x04;
    public static final byte TYPE_I32 = 0x05;
    public static final byte TYPE_I64 = 0x06;
    public static final byte TYPE_DOUBLE = 0x07;
    public static final byte TYPE_BINARY = 0x08;
    public static final byte TYPE_LIST = 0x09;
    public static final byte TYPE_SET = 0x0A;
    public static final byte TYPE_MAP = 0x0B;
    public static final byte TYPE_STRUCT = 0x0C;

    private final ByteBuffer buffer;
    private short lastFieldId = 0;

    /**
     * Creates a reader over the remaining bytes of the given buffer. The buffer's position is not
     * modified.
     */
    public ThriftCompactReader(ByteBuffer buffer) {
        this.buffer = buffer.slice().order(ByteOrder.LITTLE_ENDIAN);
    }

    /**
     * Returns the number of bytes consumed so far.
     */
    public int getBytesRead() {
        return buffer.position();
    }

    public long readVarint() throws EOFException {
        long result = 0;
        int shift = 0;
        while (buffer.hasRemaining()) {
            int b = buffer.get() & 0xFF;
            result |= (long) (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return result;
            }
            shift += 7;
            if (shift > 63) {
                throw new EOFException("Malformed varint");
            }
        }
        throw new EOFException("Unexpected EOF while reading varint");
    }

    public long readZigzag() throws IOException {
        long n = readVarint();
        return (n >>> 1) ^ -(n & 1);
    }

    public byte readByte() throws EOFException {
        if (!buffer.hasRemaining()) {
            throw new EOFException("Unexpected EOF while reading byte");
        }
        return buffer.get();
    }

    /**
     * Read a boolean collection element. Some writers encode false as 0 rather than 2.
     */
    public boolean readBoolean() throws IOException {
        byte b = readByte();
        return switch (b) {
            case TYPE_BOOLEAN_TRUE -> true;
            case TYPE_BOOLEAN_FALSE, 0 -> false;
            default -> throw new IOException("Invalid boolean value: " + b);
        };
    }

    public int readI32() throws IOException {
        return (int) readZigzag();
    }

    public long readI64() throws IOException {
        return readZigzag();
    }

    public double readDouble() throws EOFException {
        if (buffer.remaining() < Double.BYTES) {
            throw new EOFException("Unexpected EOF while reading double");
        }
        return buffer.getDouble();
    }

    public byte[] readBinary() throws IOException {
        long length = readVarint();
        if (length < 0 || length > buffer.remaining()) {
            throw new EOFException("Binary length " + length + " exceeds remaining " + buffer.remaining() + " bytes");
        }
        byte[] data = new byte[(int) length];
        buffer.get(data);
        return data;
    }

    public String readString() throws IOException {
        return new String(readBinary(), StandardCharsets.UTF_8);
    }

    /**
     * Read a field header. Returns null when the STOP field is encountered.
     */
    public FieldHeader readFieldHeader() throws IOException {
        byte b = readByte();

        if (b == 0) {
            lastFieldId = 0;
            return null;
        }

        byte type = (byte) (b & 0x0F);
        int fieldIdDelta = (b & 0xF0) >> 4;

        short fieldId;
        if (fieldIdDelta == 0) {
            fieldId = (short) readZigzag();
        }
        else {
            fieldId = (short) (lastFieldId + fieldIdDelta);
        }

        lastFieldId = fieldId;
        return new FieldHeader(fieldId, type);
    }

    public CollectionHeader readListHeader() throws IOException {
        byte sizeAndType = readByte();
        int size = (sizeAndType >> 4) & 0x0F;
        byte elementType = (byte) (sizeAndType & 0x0F);

        if (size == 15) {
            size = checkSize(readVarint(), "List");
        }

        return new CollectionHeader(elementType, size);
    }

    /**
     * Read a map header. Key and value types are only present on the wire for non-empty maps.
     */
    public MapHeader readMapHeader() throws IOException {
        int size = checkSize(readVarint(), "Map");
        if (size == 0) {
            return new MapHeader((byte) 0, (byte) 0, 0);
        }
        byte types = readByte();
        return new MapHeader((byte) ((types >> 4) & 0x0F), (byte) (types & 0x0F), size);
    }

    // every element occupies at least one byte
    private int checkSize(long size, String kind) throws IOException {
        if (size < 0 || size > buffer.remaining()) {
            throw new IOException(kind + " size " + size + " exceeds remaining " + buffer.remaining() + " bytes");
        }
        return (int) size;
    }

    public List<String> readStringList() throws IOException {
        CollectionHeader header = expectList(TYPE_BINARY);
        List<String> values = new ArrayList<>(header.size());
        for (int i = 0; i < header.size(); i++) {
            values.add(readString());
        }
        return values;
    }

    public List<Integer> readI32List() throws IOException {
        CollectionHeader header = expectList(TYPE_I32);
        List<Integer> values = new ArrayList<>(header.size());
        for (int i = 0; i < header.size(); i++) {
            values.add(readI32());
        }
        return values;
    }

    public List<Double> readDoubleList() throws IOException {
        CollectionHeader header = expectList(TYPE_DOUBLE);
        List<Double> values = new ArrayList<>(header.size());
        for (int i = 0; i < header.size(); i++) {
            values.add(readDouble());
        }
        return values;
    }

    public List<Boolean> readBooleanList() throws IOException {
        CollectionHeader header = readListHeader();
        if (header.size() > 0 && header.elementType() != TYPE_BOOLEAN_TRUE && header.elementType() != TYPE_BOOLEAN_FALSE) {
            throw new IOException("Expected list of booleans but found element type " + header.elementType());
        }
        List<Boolean> values = new ArrayList<>(header.size());
        for (int i = 0; i < header.size(); i++) {
            values.add(readBoolean());
        }
        return values;
    }

    private CollectionHeader expectList(byte elementType) throws IOException {
        CollectionHeader header = readListHeader();
        if (header.size() > 0 && header.elementType() != elementType) {
            throw new IOException("Expected list element type " + elementType + " but found " + header.elementType());
        }
        return header;
    }

    public void skipField(byte type) throws IOException {
        switch (type) {
            case TYPE_BOOLEAN_TRUE:
            case TYPE_BOOLEAN_FALSE:
                // value is carried in the type nibble
                break;
            case TYPE_BYTE:
                readByte();
                break;
            case TYPE_I16:
            case TYPE_I32:
            case TYPE_I64:
                readZigzag();
                break;
            case TYPE_DOUBLE:
                readDouble();
                break;
            case TYPE_BINARY:
                readBinary();
                break;
            case TYPE_LIST:
            case TYPE_SET:
                CollectionHeader listHeader = readListHeader();
                for (int i = 0; i < listHeader.size(); i++) {
                    skipElement(listHeader.elementType());
                }
                break;
            case TYPE_MAP:
                MapHeader mapHeader = readMapHeader();
                for (int i = 0; i < mapHeader.size(); i++) {
                    skipElement(mapHeader.keyType());
                    skipElement(mapHeader.valueType());
                }
                break;
            case TYPE_STRUCT:
                skipStruct();
                break;
            default:
                throw new IOException("Unknown field type: " + type);
        }
    }

    // Booleans inside collections occupy a full byte, unlike boolean fields
    private void skipElement(byte type) throws IOException {
        if (type == TYPE_BOOLEAN_TRUE || type == TYPE_BOOLEAN_FALSE) {
            readByte();
        }
        else {
            skipField(type);
        }
    }

    public void skipStruct() throws IOException {
        short saved = pushFieldIdContext();
        try {
            while (true) {
                FieldHeader header = readFieldHeader();
                if (header == null) {
                    break;
                }
                skipField(header.type());
            }
        }
        finally {
            popFieldIdContext(saved);
        }
    }

    public void resetLastFieldId() {
        lastFieldId = 0;
    }

    /**
     * Save the current last field ID and reset it for reading a nested struct.
     */
    public short pushFieldIdContext() {
        short saved = lastFieldId;
        lastFieldId = 0;
        return saved;
    }

    public void popFieldIdContext(short savedFieldId) {
        lastFieldId = savedFieldId;
    }

    public static record FieldHeader(short fieldId, byte type) {
    }

    public static record CollectionHeader(byte elementType, int size) {
    }

    public static record MapHeader(byte keyType, byte valueType, int size) {
    }
}
