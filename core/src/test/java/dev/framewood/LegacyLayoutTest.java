/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.framewood.frame.CollectionReadBuffers;
import dev.framewood.frame.ObjectID;
import dev.framewood.metadata.Version;
import dev.framewood.reader.FrameReader;
import dev.framewood.testing.DatasetWriter;

import static dev.framewood.FrameReaderTest.string;
import static dev.framewood.testing.FrameValues.objectIds;
import static dev.framewood.testing.FrameValues.text;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for files written by older versions, which name relation columns by index.
 */
class LegacyLayoutTest {

    @TempDir
    Path tempDir;

    private static DatasetWriter indexBasedDataset() {
        return new DatasetWriter()
                .datamodel("test", DatasetWriter.TEST_DATAMODEL)
                .category("events")
                    .collection("hits", "test::HitCollection", 10, 7)
                    .subsetCollection("selected", "test::HitCollection", 11, 7)
                    .withoutSchemaVersions()
                    .entries(2, i -> Map.of(
                            "hits", text("hits-" + i),
                            "hits#0", objectIds(new ObjectID(i, 20)),
                            "hits#1", objectIds(new ObjectID(i, 30)),
                            "hits_2", text("weights-" + i),
                            "selected_objIdx", objectIds(new ObjectID(0, 10))))
                    .done();
    }

    @Test
    void testIndexBasedColumnNames() throws Exception {
        Path file = indexBasedDataset().version(0, 16, 6).write(tempDir.resolve("legacy.fwd"));

        try (FrameReader reader = FrameReader.open(file)) {
            assertThat(reader.currentFileVersion()).isEqualTo(new Version(0, 16, 6));

            CollectionReadBuffers hits = reader.readEntry("events", 1).getCollectionBuffers("hits");
            assertThat(string(hits.data())).isEqualTo("hits-1");
            assertThat(hits.references().get(0)).containsExactly(new ObjectID(1, 20));
            assertThat(hits.references().get(1)).containsExactly(new ObjectID(1, 30));
            assertThat(string(hits.vectorMembers().get(0))).isEqualTo("weights-1");
        }
    }

    @Test
    void testMissingSchemaVersionsDefaultToOne() throws Exception {
        Path file = indexBasedDataset().version(0, 16, 6).write(tempDir.resolve("legacy.fwd"));

        try (FrameReader reader = FrameReader.open(file)) {
            CollectionReadBuffers hits = reader.readNextEntry("events").getCollectionBuffers("hits");
            CollectionReadBuffers selected = reader.readEntry("events", 0).getCollectionBuffers("selected");

            assertThat(hits.schemaVersion()).isEqualTo(1);
            assertThat(selected.schemaVersion()).isEqualTo(1);
            assertThat(selected.references()).containsExactly(List.of(new ObjectID(0, 10)));
        }
    }

    @Test
    void testFileWithoutBuildVersion() throws Exception {
        Path file = indexBasedDataset().withoutVersion().write(tempDir.resolve("unversioned.fwd"));

        try (FrameReader reader = FrameReader.open(file)) {
            assertThat(reader.currentFileVersion()).isEqualTo(Version.UNKNOWN);
            assertThat(reader.readNextEntry("events").getCollectionBuffers("hits").references()).hasSize(2);
        }
    }

    @Test
    void testUnknownCollectionTypeReadsPayloadOnly() throws Exception {
        Path file = new DatasetWriter()
                .category("events")
                    .collection("clusters", "other::ClusterCollection", 5, 3)
                    .entries(1, i -> Map.of("clusters", text("cluster-" + i)))
                    .done()
                .write(tempDir.resolve("nodatamodel.fwd"));

        try (FrameReader reader = FrameReader.open(file)) {
            assertThat(reader.getAvailableDatamodels()).isEmpty();

            CollectionReadBuffers clusters = reader.readNextEntry("events").getCollectionBuffers("clusters");
            assertThat(string(clusters.data())).isEqualTo("cluster-0");
            assertThat(clusters.schemaVersion()).isEqualTo(3);
            assertThat(clusters.references()).isEmpty();
            assertThat(clusters.vectorMembers()).isEmpty();
        }
    }
}
