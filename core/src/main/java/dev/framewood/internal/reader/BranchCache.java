/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.reader;

import java.io.IOException;
import java.util.Arrays;

/**
 * Per-category cache of resolved column handles, one slot per collection plus one for the
 * parameters column.
 * <p>
 * Slots are resolved lazily for the segment currently being read and invalidated when reading moves
 * to a different segment, as handles of one segment cannot be used for another.
 * </p>
 */
public class BranchCache {

    @FunctionalInterface
    public interface Resolver {
        CollectionBranches resolve(int segment) throws IOException;
    }

    private final BranchSlot[] slots;
    private long resolutions;

    /**
     * @param collectionSlots number of collection slots; the parameters slot is added on top
     */
    public BranchCache(int collectionSlots) {
        this.slots = new BranchSlot[collectionSlots + 1];
        Arrays.fill(slots, BranchSlot.UNRESOLVED);
    }

    public int parametersSlot() {
        return slots.length - 1;
    }

    public int size() {
        return slots.length;
    }

    public BranchSlot slot(int index) {
        return slots[index];
    }

    /**
     * Marks every slot stale.
     */
    public void invalidateAll() {
        Arrays.fill(slots, BranchSlot.UNRESOLVED);
    }

    /**
     * Returns the handles of the given slot for the given segment, resolving them first if the slot
     * is unresolved or was resolved for another segment.
     */
    public CollectionBranches get(int index, int segment, Resolver resolver) throws IOException {
        if (slots[index] instanceof BranchSlot.Resolved resolved && resolved.segment() == segment) {
            return resolved.branches();
        }
        CollectionBranches branches = resolver.resolve(segment);
        slots[index] = new BranchSlot.Resolved(segment, branches);
        resolutions++;
        return branches;
    }

    /**
     * Number of slot resolutions performed so far.
     */
    public long resolutions() {
        return resolutions;
    }
}
