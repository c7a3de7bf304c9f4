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

import com.github.luben.zstd.Zstd;

/**
 * Decompressor for ZSTD compressed baskets.
 */
public class ZstdDecompressor implements Decompressor {

    @Override
    public byte[] decompress(ByteBuffer compressed, int uncompressedSize) throws IOException {
        byte[] uncompressed = new byte[uncompressedSize];
        long actualSize = Zstd.decompress(uncompressed, Decompressor.toArray(compressed));

        if (Zstd.isError(actualSize)) {
            throw new IOException("ZSTD decompression failed: " + Zstd.getErrorName(actualSize));
        }
        if (actualSize != uncompressedSize) {
            throw new IOException(
                    "ZSTD decompression size mismatch: expected " + uncompressedSize + ", got " + actualSize);
        }

        return uncompressed;
    }

    @Override
    public String getName() {
        return "ZSTD";
    }
}
