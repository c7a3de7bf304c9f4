/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.schema;

/**
 * A collection stored in a category, as declared by the category's metadata.
 *
 * @param name the collection name, unique within its category
 * @param type the collection type name
 * @param subset whether the collection only references objects of other collections
 * @param schemaVersion the schema version the collection was written with
 * @param slot index of the collection's slot in the category's branch cache
 */
public record CollectionDescriptor(
        String name,
        String type,
        boolean subset,
        int schemaVersion,
        int slot) {
}
