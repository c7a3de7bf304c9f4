/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.reader;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import dev.framewood.frame.CollectionReadBuffers;
import dev.framewood.frame.FrameData;
import dev.framewood.frame.GenericParameters;
import dev.framewood.frame.ObjectID;
import dev.framewood.internal.reader.BranchNames.BranchColumns;
import dev.framewood.internal.thrift.GenericParametersReader;
import dev.framewood.internal.thrift.ThriftCompactReader;
import dev.framewood.reader.MetadataInconsistencyException;
import dev.framewood.schema.CollectionDescriptor;

/**
 * Assembles the {@link FrameData} of one entry of a category from the category's columns.
 */
public class FrameAssembler {

    private static final System.Logger LOG = System.getLogger(FrameAssembler.class.getName());

    /**
     * Reads the entry at the category's cursor and advances the cursor if there was one.
     *
     * @return the frame, or null if the category has no further entries
     */
    public FrameData readNext(CategoryState state) throws IOException {
        return readAt(state, state.cursor().nextEntry());
    }

    /**
     * Reads the given entry. If it exists, the next sequential read continues after it.
     *
     * @return the frame, or null if the category has no such entry
     */
    public FrameData readAt(CategoryState state, long entry) throws IOException {
        FrameData frame = build(state, entry);
        if (frame != null) {
            state.setCursor(state.cursor().afterRead(entry));
        }
        return frame;
    }

    /**
     * Builds the frame of the given entry without touching the cursor.
     *
     * @return the frame, or null if the category does not exist or has no such entry
     */
    public FrameData build(CategoryState state, long entry) throws IOException {
        if (!state.isInitialized()) {
            return null;
        }
        TreeChain chain = state.chain();
        TreeChain.Location location = chain.locate(entry);
        if (location == null) {
            return null;
        }

        int segment = location.segment();
        BranchCache cache = state.branchCache();
        if (segment != state.currentSegment()) {
            if (state.currentSegment() >= 0) {
                LOG.log(System.Logger.Level.DEBUG, "Category ''{0}'' moves from segment {1} to {2} ({3})",
                        state.name(), state.currentSegment(), segment, chain.segmentSource(segment));
            }
            cache.invalidateAll();
            state.setCurrentSegment(segment);
        }

        CategoryMetadata metadata = state.metadata();
        Map<String, CollectionReadBuffers> buffers = new LinkedHashMap<>();
        for (CollectionDescriptor descriptor : metadata.descriptors()) {
            BranchColumns columns = metadata.columns().get(descriptor.slot());
            CollectionBranches branches = cache.get(descriptor.slot(), segment,
                    s -> resolve(state, descriptor, columns, s));
            buffers.put(descriptor.name(), readBuffers(descriptor, branches, location.localEntry()));
        }

        CollectionBranches parameterBranches = cache.get(cache.parametersSlot(), segment,
                s -> new CollectionBranches(chain.openColumn(s, BranchNames.PARAMETERS), List.of(), List.of()));
        GenericParameters parameters = readParameters(parameterBranches.data(), location.localEntry());

        return new FrameData(state.name(), entry, buffers, metadata.idTable(), parameters);
    }

    private static CollectionBranches resolve(CategoryState state, CollectionDescriptor descriptor,
                                              BranchColumns columns, int segment) throws IOException {
        ColumnHandle data = columns.data() == null ? null : open(state, descriptor, columns.data(), segment);
        List<ColumnHandle> references = new ArrayList<>(columns.references().size());
        for (String column : columns.references()) {
            references.add(open(state, descriptor, column, segment));
        }
        List<ColumnHandle> vectorMembers = new ArrayList<>(columns.vectorMembers().size());
        for (String column : columns.vectorMembers()) {
            vectorMembers.add(open(state, descriptor, column, segment));
        }
        return new CollectionBranches(data, List.copyOf(references), List.copyOf(vectorMembers));
    }

    private static ColumnHandle open(CategoryState state, CollectionDescriptor descriptor, String column, int segment)
            throws MetadataInconsistencyException {
        ColumnHandle handle = state.chain().openColumn(segment, column);
        if (handle == null) {
            throw new MetadataInconsistencyException(state.name(), "column '" + column + "' of collection '"
                    + descriptor.name() + "' is missing from " + state.chain().segmentSource(segment));
        }
        return handle;
    }

    private static CollectionReadBuffers readBuffers(CollectionDescriptor descriptor, CollectionBranches branches,
                                                     long localEntry) throws IOException {
        ByteBuffer data = branches.data() == null ? null : branches.data().read(localEntry);

        List<List<ObjectID>> references = new ArrayList<>(branches.references().size());
        for (ColumnHandle reference : branches.references()) {
            references.add(List.copyOf(reference.readObjectIDs(localEntry)));
        }
        List<ByteBuffer> vectorMembers = new ArrayList<>(branches.vectorMembers().size());
        for (ColumnHandle vectorMember : branches.vectorMembers()) {
            vectorMembers.add(vectorMember.read(localEntry));
        }

        return new CollectionReadBuffers(descriptor.type(), descriptor.schemaVersion(), descriptor.subset(),
                data, List.copyOf(references), List.copyOf(vectorMembers));
    }

    private static GenericParameters readParameters(ColumnHandle handle, long localEntry) throws IOException {
        if (handle == null) {
            return GenericParameters.empty();
        }
        ByteBuffer value = handle.read(localEntry);
        if (!value.hasRemaining()) {
            return GenericParameters.empty();
        }
        return GenericParametersReader.read(new ThriftCompactReader(value));
    }
}
