/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.reader;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import dev.framewood.reader.MetadataInconsistencyException;

/**
 * Maps category names to their {@link CategoryState}, creating and initializing each state once, on
 * first access.
 * <p>
 * Names without a tree in the dataset get an uninitialized state, so optional categories can be
 * probed cheaply. A category whose metadata is inconsistent is remembered as failed and every later
 * access to it fails again; other categories are not affected.
 * </p>
 * <p>
 * Not thread-safe.
 * </p>
 */
public class CategoryRegistry {

    private static final System.Logger LOG = System.getLogger(CategoryRegistry.class.getName());

    private final DatasetBackend backend;
    private final MetadataDecoder decoder;
    private final Map<String, CategoryState> categories = new HashMap<>();
    private final Map<String, TreeChain> chains = new HashMap<>();

    public CategoryRegistry(DatasetBackend backend, MetadataDecoder decoder) {
        this.backend = backend;
        this.decoder = decoder;
    }

    /**
     * Returns the state of the given category, initializing it on first access.
     *
     * @throws MetadataInconsistencyException if the category's metadata is inconsistent
     * @throws IOException if the category's metadata cannot be read
     */
    public CategoryState getOrInit(String name) throws IOException {
        CategoryState state = categories.get(name);
        if (state == null) {
            state = create(name);
            categories.put(name, state);
            if (state.initFailure() != null) {
                throw state.initFailure();
            }
        }
        if (state.initFailure() != null) {
            throw new MetadataInconsistencyException(name, "category is unreadable", state.initFailure());
        }
        return state;
    }

    private CategoryState create(String name) throws IOException {
        TreeChain chain = BranchNames.METADATA_TREE.equals(name) ? null : chain(name);
        if (chain == null) {
            LOG.log(System.Logger.Level.DEBUG, "No tree for category ''{0}''", name);
            return CategoryState.uninitialized(name);
        }

        CategoryState state = new CategoryState(name, chain);
        try {
            state.initialize(decoder.decode(name));
            LOG.log(System.Logger.Level.DEBUG, "Initialized category ''{0}'': {1} entries in {2} segments, collections {3}",
                    name, chain.entryCount(), chain.segmentCount(), state.descriptors());
        }
        catch (MetadataInconsistencyException e) {
            LOG.log(System.Logger.Level.WARNING, "Category ''{0}'' cannot be read: {1}", name, e.getMessage());
            state.failInitialization(e);
        }
        return state;
    }

    /**
     * Number of entries of the given category without initializing it; 0 for unknown categories.
     */
    public long entryCount(String name) {
        CategoryState state = categories.get(name);
        if (state != null) {
            return state.entryCount();
        }
        if (BranchNames.METADATA_TREE.equals(name)) {
            return 0;
        }
        TreeChain chain = chain(name);
        return chain == null ? 0 : chain.entryCount();
    }

    private TreeChain chain(String name) {
        if (!chains.containsKey(name)) {
            chains.put(name, backend.chain(name));
        }
        return chains.get(name);
    }
}
