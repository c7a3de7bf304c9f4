/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.compression;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.EnumMap;
import java.util.Map;

import dev.framewood.metadata.CompressionCodec;

/**
 * Hands out decompressors by compression codec.
 * <p>
 * Decompressors are stateless apart from their library handles, so one instance per codec is
 * created lazily and reused.
 * </p>
 */
public class DecompressorFactory {

    private static final Logger LOG = System.getLogger(DecompressorFactory.class.getName());

    private final Map<CompressionCodec, Decompressor> decompressors = new EnumMap<>(CompressionCodec.class);

    /**
     * Get a decompressor for the given compression codec.
     *
     * @param codec the compression codec
     * @return the decompressor
     * @throws UnsupportedOperationException if the library required for the codec is missing
     */
    public synchronized Decompressor getDecompressor(CompressionCodec codec) {
        Decompressor decompressor = decompressors.get(codec);
        if (decompressor == null) {
            decompressor = create(codec);
            LOG.log(Level.INFO, "Using {0} decompressor {1}", codec, decompressor.getClass().getSimpleName());
            decompressors.put(codec, decompressor);
        }
        return decompressor;
    }

    private static Decompressor create(CompressionCodec codec) {
        return switch (codec) {
            case UNCOMPRESSED -> new UncompressedDecompressor();
            case GZIP -> new GzipDecompressor();
            case SNAPPY -> {
                checkClassAvailable("org.xerial.snappy.Snappy",
                        "SNAPPY",
                        "org.xerial.snappy:snappy-java");
                yield new SnappyDecompressor();
            }
            case ZSTD -> {
                checkClassAvailable("com.github.luben.zstd.Zstd",
                        "ZSTD",
                        "com.github.luben:zstd-jni");
                yield new ZstdDecompressor();
            }
            case LZ4 -> {
                checkClassAvailable("net.jpountz.lz4.LZ4Factory",
                        "LZ4",
                        "org.lz4:lz4-java");
                yield new Lz4Decompressor();
            }
        };
    }

    private static void checkClassAvailable(String className, String codecName, String dependency) {
        try {
            Class.forName(className);
        }
        catch (ClassNotFoundException e) {
            throw new UnsupportedOperationException(
                    "Cannot read " + codecName + "-compressed baskets: required library not found. " +
                            "Add the following dependency to your project: " + dependency, e);
        }
    }
}
