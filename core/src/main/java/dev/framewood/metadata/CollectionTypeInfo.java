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
 * Per-category collection declarations as stored in the metadata tree. The lists are parallel; their
 * lengths are validated when the category is initialized, not here.
 *
 * @param names collection names
 * @param types collection type names
 * @param subsetFlags whether each collection is a subset collection
 * @param schemaVersions schema version of each collection, or null if the file does not record them
 */
public record CollectionTypeInfo(
        List<String> names,
        List<String> types,
        List<Boolean> subsetFlags,
        List<Integer> schemaVersions) {
}
