/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.reader;

import java.util.List;

import dev.framewood.frame.CollectionIDTable;
import dev.framewood.internal.reader.BranchNames.BranchColumns;
import dev.framewood.schema.CollectionDescriptor;

/**
 * Decoded metadata of one category.
 *
 * @param descriptors the collections of the category, in declaration order; a descriptor's slot is its index
 * @param columns the columns holding each collection's buffers, parallel to {@code descriptors}
 * @param idTable the category's collection ID table
 */
public record CategoryMetadata(
        List<CollectionDescriptor> descriptors,
        List<BranchColumns> columns,
        CollectionIDTable idTable) {
}
