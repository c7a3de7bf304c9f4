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
 * Metadata of one tree (a named table of entries) within a single file.
 */
public record TreeMetaData(
        String name,
        long numEntries,
        List<ColumnMetaData> columns) {

    /**
     * Returns the column with the given name, or null if this tree has no such column.
     */
    public ColumnMetaData column(String columnName) {
        for (ColumnMetaData column : columns) {
            if (column.name().equals(columnName)) {
                return column;
            }
        }
        return null;
    }
}
