/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.reader;

import java.io.IOException;

/**
 * Signals that the metadata describing a category is inconsistent or incompatible, e.g. the number
 * of declared collections does not match the number of declared types, subset flags or schema
 * versions, or a declared collection column is missing.
 * <p>
 * The affected category cannot be read; other categories of the same reader remain usable.
 * </p>
 */
public class MetadataInconsistencyException extends IOException {

    private static final long serialVersionUID = 1L;

    private final String category;

    public MetadataInconsistencyException(String category, String message) {
        super("Category '" + category + "': " + message);
        this.category = category;
    }

    public MetadataInconsistencyException(String category, String message, Throwable cause) {
        super("Category '" + category + "': " + message, cause);
        this.category = category;
    }

    /**
     * The category whose metadata is inconsistent.
     */
    public String getCategory() {
        return category;
    }
}
