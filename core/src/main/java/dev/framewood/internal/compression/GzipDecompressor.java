/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.compression;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * Decompressor for GZIP-compressed baskets, inflating directly into the result array.
 * <p>
 * Only a single GZIP member per basket is supported.
 * </p>
 */
public class GzipDecompressor implements Decompressor {

    private static final int GZIP_MAGIC = 0x8b1f;
    private static final int FHCRC = 2;
    private static final int FEXTRA = 4;
    private static final int FNAME = 8;
    private static final int FCOMMENT = 16;
    private static final int TRAILER_SIZE = 8;

    @Override
    public byte[] decompress(ByteBuffer compressed, int uncompressedSize) throws IOException {
        byte[] input = Decompressor.toArray(compressed);
        int headerSize = headerSize(input);

        byte[] result = new byte[uncompressedSize];
        Inflater inflater = new Inflater(true);
        try {
            inflater.setInput(input, headerSize, input.length - headerSize - TRAILER_SIZE);
            int total = 0;
            while (total < uncompressedSize && !inflater.finished()) {
                int inflated = inflater.inflate(result, total, uncompressedSize - total);
                if (inflated == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new IOException("Truncated GZIP basket");
                }
                total += inflated;
            }
            if (total != uncompressedSize || !inflater.finished()) {
                throw new IOException("GZIP decompression size mismatch: expected " + uncompressedSize + ", got "
                        + (inflater.finished() ? total : "more than " + total));
            }
        }
        catch (DataFormatException e) {
            throw new IOException("GZIP decompression failed", e);
        }
        finally {
            inflater.end();
        }
        return result;
    }

    private static int headerSize(byte[] data) throws IOException {
        if (data.length < 10 + TRAILER_SIZE) {
            throw new IOException("GZIP data too short");
        }
        int magic = (data[0] & 0xff) | ((data[1] & 0xff) << 8);
        if (magic != GZIP_MAGIC) {
            throw new IOException("Not in GZIP format");
        }
        if (data[2] != 8) {
            throw new IOException("Unsupported compression method: " + data[2]);
        }

        int flags = data[3] & 0xff;
        int offset = 10;
        if ((flags & FEXTRA) != 0) {
            offset += 2 + ((data[offset] & 0xff) | ((data[offset + 1] & 0xff) << 8));
        }
        if ((flags & FNAME) != 0) {
            offset = skipZeroTerminated(data, offset);
        }
        if ((flags & FCOMMENT) != 0) {
            offset = skipZeroTerminated(data, offset);
        }
        if ((flags & FHCRC) != 0) {
            offset += 2;
        }
        if (offset >= data.length - TRAILER_SIZE) {
            throw new IOException("GZIP header extends beyond data");
        }
        return offset;
    }

    private static int skipZeroTerminated(byte[] data, int offset) {
        while (offset < data.length && data[offset] != 0) {
            offset++;
        }
        return offset + 1;
    }

    @Override
    public String getName() {
        return "GZIP";
    }
}
