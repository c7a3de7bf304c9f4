/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.reader;

/**
 * State of one branch cache slot: either not resolved, or resolved against a specific segment.
 */
public sealed interface BranchSlot {

    Unresolved UNRESOLVED = new Unresolved();

    record Unresolved() implements BranchSlot {
    }

    record Resolved(int segment, CollectionBranches branches) implements BranchSlot {
    }
}
