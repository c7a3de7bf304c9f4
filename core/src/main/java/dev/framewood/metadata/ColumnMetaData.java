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
 * Column metadata: name, codec and the baskets holding the column's entries, ordered by first entry.
 */
public record ColumnMetaData(
        String name,
        CompressionCodec codec,
        List<Basket> baskets) {

    /**
     * Number of entries stored across all baskets of this column.
     */
    public long storedEntries() {
        long total = 0;
        for (Basket basket : baskets) {
            total += basket.numEntries();
        }
        return total;
    }
}
