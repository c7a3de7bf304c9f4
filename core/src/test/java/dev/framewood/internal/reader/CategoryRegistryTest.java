/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.reader;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import dev.framewood.frame.FrameData;
import dev.framewood.internal.compression.DecompressorFactory;
import dev.framewood.testing.DatasetWriter;

import static dev.framewood.testing.FrameValues.text;
import static org.assertj.core.api.Assertions.assertThat;

class CategoryRegistryTest {

    private static SegmentState segment(String prefix, int events) throws Exception {
        byte[] file = new DatasetWriter()
                .category("events")
                    .collection("tracks", "test::TrackCollection", 1, 1)
                    .entries(events, i -> Map.of("tracks", text(prefix + i)))
                    .done()
                .toByteArray();
        return SegmentLoader.load(ByteBuffer.wrap(file));
    }

    private static CategoryRegistry registry(SegmentState... segments) throws Exception {
        DatasetBackend backend = new DatasetBackend(List.of(segments), new DecompressorFactory());
        return new CategoryRegistry(backend, MetadataDecoder.open(backend));
    }

    @Test
    void testStateIsCreatedOnce() throws Exception {
        CategoryRegistry registry = registry(segment("a", 2));

        CategoryState state = registry.getOrInit("events");

        assertThat(state.isInitialized()).isTrue();
        assertThat(state.entryCount()).isEqualTo(2);
        assertThat(state.descriptors()).hasSize(1);
        assertThat(state.cursor()).isEqualTo(CategoryCursor.FRESH);
        assertThat(registry.getOrInit("events")).isSameAs(state);
    }

    @Test
    void testUnknownCategoryIsUninitialized() throws Exception {
        CategoryRegistry registry = registry(segment("a", 2));

        CategoryState state = registry.getOrInit("runs");

        assertThat(state.isInitialized()).isFalse();
        assertThat(state.entryCount()).isZero();
        assertThat(new FrameAssembler().readNext(state)).isNull();
        assertThat(state.cursor()).isEqualTo(CategoryCursor.FRESH);
        assertThat(registry.entryCount("runs")).isZero();
    }

    @Test
    void testEntryCountDoesNotInitialize() throws Exception {
        CategoryRegistry registry = registry(segment("a", 2), segment("b", 3));

        assertThat(registry.entryCount("events")).isEqualTo(5);
        assertThat(registry.getOrInit("events").entryCount()).isEqualTo(5);
    }

    @Test
    void testBranchesAreResolvedPerSegment() throws Exception {
        CategoryRegistry registry = registry(segment("a", 2), segment("b", 2));
        CategoryState state = registry.getOrInit("events");
        FrameAssembler assembler = new FrameAssembler();
        // one collection slot plus the parameters slot
        int slots = 2;

        assembler.readNext(state);
        assembler.readNext(state);
        assertThat(state.currentSegment()).isZero();
        assertThat(state.branchCache().resolutions()).isEqualTo(slots);

        FrameData third = assembler.readNext(state);
        assertThat(third.getEntry()).isEqualTo(2);
        assertThat(state.currentSegment()).isEqualTo(1);
        assertThat(state.branchCache().resolutions()).isEqualTo(2 * slots);

        FrameData first = assembler.readAt(state, 0);
        assertThat(first.getCollectionBuffers("tracks").data()).isEqualTo(ByteBuffer.wrap(text("a0")));
        assertThat(state.branchCache().resolutions()).isEqualTo(3 * slots);
        assertThat(state.cursor()).isEqualTo(new CategoryCursor.Positioned(1));
    }

    @Test
    void testBuildDoesNotMoveCursor() throws Exception {
        CategoryRegistry registry = registry(segment("a", 3));
        CategoryState state = registry.getOrInit("events");
        FrameAssembler assembler = new FrameAssembler();

        FrameData frame = assembler.build(state, 2);

        assertThat(frame.getCollectionBuffers("tracks").data()).isEqualTo(ByteBuffer.wrap(text("a2")));
        assertThat(state.cursor()).isEqualTo(CategoryCursor.FRESH);
        assertThat(assembler.readAt(state, 3)).isNull();
        assertThat(state.cursor()).isEqualTo(CategoryCursor.FRESH);
    }
}
