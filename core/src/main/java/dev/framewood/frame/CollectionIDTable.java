/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.frame;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable bidirectional mapping between collection names and their numeric collection IDs.
 * <p>
 * One table exists per category; it is shared by every {@link FrameData} read for that category
 * and is used to resolve the collection IDs found in relation buffers.
 * </p>
 */
public final class CollectionIDTable {

    private final List<Integer> ids;
    private final List<String> names;
    private final Map<String, Integer> idsByName;
    private final Map<Integer, String> namesById;

    public CollectionIDTable(List<Integer> ids, List<String> names) {
        if (ids.size() != names.size()) {
            throw new IllegalArgumentException("Collection ID table has " + ids.size() + " ids but " + names.size() + " names");
        }
        this.ids = List.copyOf(ids);
        this.names = List.copyOf(names);
        Map<String, Integer> byName = new HashMap<>();
        Map<Integer, String> byId = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            byName.put(names.get(i), ids.get(i));
            byId.put(ids.get(i), names.get(i));
        }
        this.idsByName = Collections.unmodifiableMap(byName);
        this.namesById = Collections.unmodifiableMap(byId);
    }

    public List<Integer> ids() {
        return ids;
    }

    public List<String> names() {
        return names;
    }

    public boolean isPresent(String name) {
        return idsByName.containsKey(name);
    }

    /**
     * Returns the collection ID registered for the given name.
     *
     * @throws IllegalArgumentException if no collection with that name is registered
     */
    public int collectionID(String name) {
        Integer id = idsByName.get(name);
        if (id == null) {
            throw new IllegalArgumentException("Collection not found in ID table: " + name);
        }
        return id;
    }

    /**
     * Returns the name of the collection with the given ID, or null if the ID is unknown.
     */
    public String name(int collectionID) {
        return namesById.get(collectionID);
    }

    public int size() {
        return ids.size();
    }

    @Override
    public String toString() {
        return "CollectionIDTable" + idsByName;
    }
}
