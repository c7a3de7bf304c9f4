/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.reader;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BranchCacheTest {

    private int resolved;

    private CollectionBranches resolve(int segment) {
        resolved++;
        return new CollectionBranches(null, List.of(), List.of());
    }

    @Test
    void testSlotsStartUnresolved() {
        BranchCache cache = new BranchCache(2);

        assertThat(cache.size()).isEqualTo(3);
        assertThat(cache.parametersSlot()).isEqualTo(2);
        for (int i = 0; i < cache.size(); i++) {
            assertThat(cache.slot(i)).isInstanceOf(BranchSlot.Unresolved.class);
        }
    }

    @Test
    void testSlotIsResolvedOncePerSegment() throws Exception {
        BranchCache cache = new BranchCache(1);

        CollectionBranches first = cache.get(0, 0, this::resolve);
        CollectionBranches second = cache.get(0, 0, this::resolve);

        assertThat(second).isSameAs(first);
        assertThat(resolved).isEqualTo(1);
        assertThat(cache.slot(0)).isEqualTo(new BranchSlot.Resolved(0, first));
    }

    @Test
    void testOtherSegmentResolvesAgain() throws Exception {
        BranchCache cache = new BranchCache(1);

        cache.get(0, 0, this::resolve);
        cache.get(0, 1, this::resolve);

        assertThat(resolved).isEqualTo(2);
        assertThat(cache.resolutions()).isEqualTo(2);
        assertThat(((BranchSlot.Resolved) cache.slot(0)).segment()).isEqualTo(1);
    }

    @Test
    void testInvalidateAll() throws Exception {
        BranchCache cache = new BranchCache(1);
        cache.get(0, 0, this::resolve);
        cache.get(cache.parametersSlot(), 0, this::resolve);

        cache.invalidateAll();

        assertThat(cache.slot(0)).isEqualTo(BranchSlot.UNRESOLVED);
        assertThat(cache.slot(1)).isEqualTo(BranchSlot.UNRESOLVED);
        cache.get(0, 0, this::resolve);
        assertThat(resolved).isEqualTo(3);
    }

    @Test
    void testCursorTransitions() {
        CategoryCursor cursor = CategoryCursor.FRESH;
        assertThat(cursor.nextEntry()).isZero();

        cursor = cursor.afterRead(0);
        assertThat(cursor).isEqualTo(new CategoryCursor.Positioned(1));

        // seeking backwards
        cursor = cursor.afterRead(0);
        assertThat(cursor.nextEntry()).isEqualTo(1);

        cursor = cursor.afterRead(41);
        assertThat(cursor.nextEntry()).isEqualTo(42);
    }
}
