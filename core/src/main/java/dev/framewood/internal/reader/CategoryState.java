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
import dev.framewood.reader.MetadataInconsistencyException;
import dev.framewood.schema.CollectionDescriptor;

/**
 * All state needed to read the entries of one category: its tree chain, its collections, the
 * branch cache and the read cursor.
 * <p>
 * A state without a tree chain stands for a category that does not exist in the dataset; it has no
 * entries and every read of it yields no data. A state whose metadata could not be decoded keeps the
 * failure and has no collections.
 * </p>
 */
public class CategoryState {

    private final String name;
    private final TreeChain chain;

    private CategoryMetadata metadata;
    private BranchCache branchCache;
    private MetadataInconsistencyException initFailure;

    private CategoryCursor cursor = CategoryCursor.FRESH;
    private int currentSegment = -1;

    CategoryState(String name, TreeChain chain) {
        this.name = name;
        this.chain = chain;
    }

    static CategoryState uninitialized(String name) {
        return new CategoryState(name, null);
    }

    void initialize(CategoryMetadata metadata) {
        this.metadata = metadata;
        this.branchCache = new BranchCache(metadata.descriptors().size());
    }

    void failInitialization(MetadataInconsistencyException failure) {
        this.initFailure = failure;
    }

    public String name() {
        return name;
    }

    /**
     * Whether this category exists and its metadata was decoded.
     */
    public boolean isInitialized() {
        return metadata != null;
    }

    public MetadataInconsistencyException initFailure() {
        return initFailure;
    }

    public TreeChain chain() {
        return chain;
    }

    public long entryCount() {
        return chain == null ? 0 : chain.entryCount();
    }

    public List<CollectionDescriptor> descriptors() {
        return metadata == null ? List.of() : metadata.descriptors();
    }

    public CategoryMetadata metadata() {
        return metadata;
    }

    public CollectionIDTable idTable() {
        return metadata == null ? null : metadata.idTable();
    }

    public BranchCache branchCache() {
        return branchCache;
    }

    public CategoryCursor cursor() {
        return cursor;
    }

    void setCursor(CategoryCursor cursor) {
        this.cursor = cursor;
    }

    /**
     * Segment of the most recently served entry, or -1 if nothing was served yet.
     */
    public int currentSegment() {
        return currentSegment;
    }

    void setCurrentSegment(int segment) {
        this.currentSegment = segment;
    }

    @Override
    public String toString() {
        return "CategoryState[name=" + name + ", entries=" + entryCount() + ", cursor=" + cursor + "]";
    }
}
