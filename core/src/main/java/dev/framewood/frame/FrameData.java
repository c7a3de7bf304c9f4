/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.frame;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All data of one entry of a category: the buffers of every collection, the category's shared
 * collection ID table and the entry's parameters.
 * <p>
 * Collections are kept in the order in which they are declared for the category.
 * </p>
 */
public final class FrameData {

    private final String category;
    private final long entry;
    private final Map<String, CollectionReadBuffers> buffers;
    private final CollectionIDTable idTable;
    private final GenericParameters parameters;

    public FrameData(String category, long entry, Map<String, CollectionReadBuffers> buffers,
                     CollectionIDTable idTable, GenericParameters parameters) {
        this.category = category;
        this.entry = entry;
        this.buffers = Collections.unmodifiableMap(new LinkedHashMap<>(buffers));
        this.idTable = idTable;
        this.parameters = parameters;
    }

    public String getCategory() {
        return category;
    }

    /**
     * The global entry index this frame was read from.
     */
    public long getEntry() {
        return entry;
    }

    public List<String> getAvailableCollections() {
        return new ArrayList<>(buffers.keySet());
    }

    /**
     * Returns the buffers of the named collection, or null if the frame has no such collection.
     */
    public CollectionReadBuffers getCollectionBuffers(String name) {
        return buffers.get(name);
    }

    public Map<String, CollectionReadBuffers> getAllCollectionBuffers() {
        return buffers;
    }

    public CollectionIDTable getIDTable() {
        return idTable;
    }

    public GenericParameters getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return "FrameData[category=" + category + ", entry=" + entry + ", collections=" + buffers.keySet() + "]";
    }
}
