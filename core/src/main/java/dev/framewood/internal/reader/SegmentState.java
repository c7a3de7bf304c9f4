/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.reader;

import java.nio.ByteBuffer;

import dev.framewood.metadata.FileMetaData;

/**
 * One physical file (or in-memory buffer) contributing to a chained dataset.
 * <p>
 * For files the channel is closed right after memory-mapping; the mapping stays valid until it is
 * garbage collected.
 * </p>
 *
 * @param index position of this segment within the chain
 * @param source the path or a description of the in-memory source
 * @param data buffer covering the complete segment
 * @param fileMetaData the parsed footer
 */
public record SegmentState(
        int index,
        String source,
        ByteBuffer data,
        FileMetaData fileMetaData) {
}
