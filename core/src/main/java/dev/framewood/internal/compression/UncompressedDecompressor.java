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

/**
 * Passthrough for uncompressed baskets.
 */
public class UncompressedDecompressor implements Decompressor {

    @Override
    public byte[] decompress(ByteBuffer compressed, int uncompressedSize) throws IOException {
        if (compressed.remaining() != uncompressedSize) {
            throw new IOException("Uncompressed basket size mismatch: expected " + uncompressedSize
                    + ", got " + compressed.remaining());
        }
        return Decompressor.toArray(compressed);
    }

    @Override
    public String getName() {
        return "UNCOMPRESSED";
    }
}
