/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.frame;

/**
 * Reference to one object of a collection: its index within the collection and the collection's ID.
 * <p>
 * Relation buffers and subset collections are stored as sequences of these.
 * </p>
 */
public record ObjectID(int index, int collectionID) {

    /**
     * Size of one packed object ID in a relation column value.
     */
    public static final int BYTES = 2 * Integer.BYTES;

    public static final int UNTRACKED = -2;
    public static final int INVALID = -1;

    public boolean isValid() {
        return index >= 0 && collectionID != INVALID;
    }
}
