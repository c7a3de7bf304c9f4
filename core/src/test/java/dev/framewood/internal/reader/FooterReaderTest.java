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
import java.nio.ByteOrder;
import java.util.List;

import org.junit.jupiter.api.Test;

import dev.framewood.metadata.CompressionCodec;
import dev.framewood.metadata.FileMetaData;
import dev.framewood.metadata.TreeMetaData;
import dev.framewood.testing.FrameFileWriter;

import static dev.framewood.testing.FrameValues.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FooterReaderTest {

    @Test
    void testReadMetadata() throws Exception {
        byte[] file = new FrameFileWriter()
                .tree("events", 3).column("a", CompressionCodec.ZSTD, List.of(text("1"), text("2"), text("3")), 2).done()
                .tree("runs", 1).column("b", List.of(text("r"))).done()
                .toByteArray();

        FileMetaData metaData = FooterReader.readMetadata(ByteBuffer.wrap(file), "test");

        assertThat(metaData.createdBy()).isEqualTo("framewood tests");
        assertThat(metaData.trees()).extracting(TreeMetaData::name).containsExactly("events", "runs");
        TreeMetaData events = metaData.tree("events");
        assertThat(events.numEntries()).isEqualTo(3);
        assertThat(events.column("a").codec()).isEqualTo(CompressionCodec.ZSTD);
        assertThat(events.column("a").baskets()).hasSize(2);
        assertThat(events.column("a").storedEntries()).isEqualTo(3);
        assertThat(metaData.tree("missing")).isNull();
    }

    @Test
    void testTooSmall() {
        assertThatThrownBy(() -> FooterReader.readMetadata(ByteBuffer.wrap(FooterReader.MAGIC), "tiny"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("too small");
    }

    @Test
    void testInvalidEndMagic() {
        byte[] file = new FrameFileWriter().toByteArray();
        file[file.length - 1] = 'X';

        assertThatThrownBy(() -> FooterReader.readMetadata(ByteBuffer.wrap(file), "broken"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("invalid magic number at end");
    }

    @Test
    void testInvalidFooterLength() {
        byte[] file = new FrameFileWriter().toByteArray();
        ByteBuffer.wrap(file).order(ByteOrder.LITTLE_ENDIAN).putInt(file.length - 8, 1000);

        assertThatThrownBy(() -> FooterReader.readMetadata(ByteBuffer.wrap(file), "broken"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Invalid footer length");
    }

    @Test
    void testBasketBeyondTreeEntries() {
        byte[] file = new FrameFileWriter()
                .tree("events", 1).column("a", List.of(text("1"), text("2"))).done()
                .toByteArray();

        assertThatThrownBy(() -> FooterReader.readMetadata(ByteBuffer.wrap(file), "broken"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("beyond the tree's 1 entries");
    }

    @Test
    void testUnsortedBaskets() {
        byte[] file = new FrameFileWriter()
                .tree("events", 4).column("a", List.of(text("1"), text("2"), text("3"), text("4"))).done()
                .reverseBaskets()
                .toByteArray();

        assertThatThrownBy(() -> FooterReader.readMetadata(ByteBuffer.wrap(file), "broken"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Baskets of column 'events/a' are unsorted or overlap at entry 0");
    }
}
