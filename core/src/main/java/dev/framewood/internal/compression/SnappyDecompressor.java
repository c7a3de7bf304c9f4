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

import org.xerial.snappy.Snappy;

/**
 * Decompressor for Snappy compressed baskets.
 */
public class SnappyDecompressor implements Decompressor {

    @Override
    public byte[] decompress(ByteBuffer compressed, int uncompressedSize) throws IOException {
        byte[] input = Decompressor.toArray(compressed);
        if (Snappy.uncompressedLength(input) != uncompressedSize) {
            throw new IOException("Snappy decompression size mismatch: expected " + uncompressedSize
                    + ", got " + Snappy.uncompressedLength(input));
        }
        byte[] uncompressed = new byte[uncompressedSize];
        Snappy.uncompress(input, 0, input.length, uncompressed, 0);
        return uncompressed;
    }

    @Override
    public String getName() {
        return "SNAPPY";
    }
}
