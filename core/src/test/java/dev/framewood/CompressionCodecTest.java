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

import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import dev.framewood.frame.CollectionReadBuffers;
import dev.framewood.frame.FrameData;
import dev.framewood.frame.ObjectID;
import dev.framewood.metadata.CompressionCodec;
import dev.framewood.reader.FrameReader;
import dev.framewood.testing.DatasetWriter;
import dev.framewood.testing.FrameValues;

import static dev.framewood.FrameReaderTest.string;
import static dev.framewood.testing.FrameValues.objectIds;
import static dev.framewood.testing.FrameValues.text;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Reads the same dataset stored with each supported basket compression codec.
 */
class CompressionCodecTest {

    @TempDir
    Path tempDir;

    @ParameterizedTest
    @EnumSource(CompressionCodec.class)
    void testReadCompressedBaskets(CompressionCodec codec) throws Exception {
        // repetitive values so that every codec actually compresses
        String padding = "x".repeat(200);
        Path file = new DatasetWriter()
                .datamodel("test", DatasetWriter.TEST_DATAMODEL)
                .codec(codec, 3)
                .category("events")
                    .collection("hits", "test::HitCollection", 10, 2)
                    .entries(10, i -> Map.of(
                            "hits", text("hits-" + i + padding),
                            "_hits_particles", objectIds(new ObjectID(i, 20), new ObjectID(i, 21)),
                            "_hits_track", objectIds(new ObjectID(i, 30)),
                            "_hits_weights", text("weights-" + i),
                            "PARAMETERS", FrameValues.parameters(Map.of("n", List.of(i)), Map.of(), Map.of(), Map.of())))
                    .done()
                .write(tempDir.resolve(codec.name().toLowerCase() + ".fwd"));

        try (FrameReader reader = FrameReader.open(file)) {
            int count = 0;
            FrameData frame;
            while ((frame = reader.readNextEntry("events")) != null) {
                CollectionReadBuffers hits = frame.getCollectionBuffers("hits");
                assertThat(string(hits.data())).isEqualTo("hits-" + count + padding);
                assertThat(hits.references().get(0)).containsExactly(new ObjectID(count, 20), new ObjectID(count, 21));
                assertThat(hits.references().get(1)).containsExactly(new ObjectID(count, 30));
                assertThat(string(hits.vectorMembers().get(0))).isEqualTo("weights-" + count);
                assertThat(frame.getParameters().getInts("n")).containsExactly(count);
                count++;
            }
            assertThat(count).isEqualTo(10);

            // random access into a basket other than the cached one
            assertThat(string(reader.readEntry("events", 4).getCollectionBuffers("hits").data()))
                    .isEqualTo("hits-4" + padding);
        }
    }
}
