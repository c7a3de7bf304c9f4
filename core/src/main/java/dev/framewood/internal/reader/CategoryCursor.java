/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.reader;

/**
 * Read position of a category.
 * <p>
 * A category starts {@link Fresh}. A successful sequential read of entry {@code n} or a successful
 * read of explicit entry {@code n} both move it to {@code Positioned(n + 1)}. Reads that hit the end
 * of data leave it unchanged.
 * </p>
 */
public sealed interface CategoryCursor {

    Fresh FRESH = new Fresh();

    /**
     * The entry the next sequential read will return.
     */
    long nextEntry();

    /**
     * The cursor after entry {@code entry} was read successfully.
     */
    default CategoryCursor afterRead(long entry) {
        return new Positioned(entry + 1);
    }

    record Fresh() implements CategoryCursor {
        @Override
        public long nextEntry() {
            return 0;
        }
    }

    record Positioned(long nextEntry) implements CategoryCursor {
    }
}
