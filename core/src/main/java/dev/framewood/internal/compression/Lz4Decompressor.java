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

import net.jpountz.lz4.LZ4Exception;
import net.jpountz.lz4.LZ4Factory;
import net.jpountz.lz4.LZ4SafeDecompressor;

/**
 * Decompressor for LZ4 compressed baskets (raw LZ4 block format, no framing).
 */
public class Lz4Decompressor implements Decompressor {

    private final LZ4SafeDecompressor decompressor;

    public Lz4Decompressor() {
        this.decompressor = LZ4Factory.fastestInstance().safeDecompressor();
    }

    @Override
    public byte[] decompress(ByteBuffer compressed, int uncompressedSize) throws IOException {
        byte[] input = Decompressor.toArray(compressed);
        byte[] uncompressed = new byte[uncompressedSize];
        try {
            int actualSize = decompressor.decompress(input, 0, input.length, uncompressed, 0, uncompressedSize);
            if (actualSize != uncompressedSize) {
                throw new IOException(
                        "LZ4 decompression size mismatch: expected " + uncompressedSize + ", got " + actualSize);
            }
        }
        catch (LZ4Exception e) {
            throw new IOException("LZ4 decompression failed", e);
        }
        return uncompressed;
    }

    @Override
    public String getName() {
        return "LZ4";
    }
}
