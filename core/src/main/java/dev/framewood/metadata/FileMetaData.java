/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.metadata;

import java.util.List;

/**
 * File-level metadata decoded from the footer.
 */
public record FileMetaData(
        int version,
        List<TreeMetaData> trees,
        String createdBy) {

    /**
     * Returns the tree with the given name, or null if the file does not contain it.
     */
    public TreeMetaData tree(String name) {
        for (TreeMetaData tree : trees) {
            if (tree.name().equals(name)) {
                return tree;
            }
        }
        return null;
    }
}
