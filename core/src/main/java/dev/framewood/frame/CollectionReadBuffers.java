/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.frame;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * Raw buffers of one collection for one frame, tagged with the collection's type and on-disk schema
 * version.
 * <p>
 * A full collection owns its payload ({@code data}) and carries one relation buffer per relation and
 * one buffer per vector member. A subset collection has no payload; its single relation buffer lists
 * the referenced objects.
 * </p>
 * <p>
 * Each call to {@link #data()} or {@link #vectorMembers()} returns fresh views positioned at the
 * start of the value, so reading one does not affect later readers.
 * </p>
 *
 * @param type the collection type name
 * @param schemaVersion the schema version the buffers were written with
 * @param subset whether this is a subset collection
 * @param data the payload bytes (little endian), or null for subset collections
 * @param references the relation buffers
 * @param vectorMembers the vector member buffers (little endian)
 */
public record CollectionReadBuffers(
        String type,
        int schemaVersion,
        boolean subset,
        ByteBuffer data,
        List<List<ObjectID>> references,
        List<ByteBuffer> vectorMembers) {

    @Override
    public ByteBuffer data() {
        return data == null ? null : view(data);
    }

    @Override
    public List<ByteBuffer> vectorMembers() {
        List<ByteBuffer> views = new ArrayList<>(vectorMembers.size());
        for (ByteBuffer member : vectorMembers) {
            views.add(view(member));
        }
        return views;
    }

    private static ByteBuffer view(ByteBuffer buffer) {
        return buffer.duplicate().order(ByteOrder.LITTLE_ENDIAN);
    }

    public boolean hasPayload() {
        return data != null;
    }
}
