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
 * Decompresses the data block of one basket.
 */
public interface Decompressor {

    /**
     * Decompress the given block.
     *
     * @param compressed buffer whose remaining bytes are the compressed block; its position is not modified
     * @param uncompressedSize the expected size of the uncompressed data
     * @return the uncompressed data, exactly {@code uncompressedSize} bytes long
     * @throws IOException if the data is corrupt or its size does not match
     */
    byte[] decompress(ByteBuffer compressed, int uncompressedSize) throws IOException;

    /**
     * Get the name of this decompressor.
     */
    String getName();

    /**
     * Copies the remaining bytes of the given buffer into a new array.
     */
    static byte[] toArray(ByteBuffer buffer) {
        byte[] bytes = new byte[buffer.remaining()];
        buffer.duplicate().get(bytes);
        return bytes;
    }
}
