/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.testing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntFunction;

import dev.framewood.metadata.CompressionCodec;

/**
 * Builds complete frame datasets for tests: category trees plus the metadata tree describing them.
 *
 * <pre>{@code
 * byte[] file = new DatasetWriter()
 *         .category("events")
 *             .collection("hits", "test::HitCollection", 1, 2)
 *             .entries(3, i -> Map.of("hits", FrameValues.text("hit" + i)))
 *             .done()
 *         .toByteArray();
 * }</pre>
 */
public class DatasetWriter {

    public static final String METADATA_TREE = "frame_metadata";

    /**
     * Datamodel with a hit type carrying two relations and a vector member, and a particle type
     * without any.
     */
    public static final String TEST_DATAMODEL = "{"
            + "\"schema_version\": 2,"
            + "\"datatypes\": {"
            + "  \"test::Hit\": {"
            + "    \"Members\": [\"float energy // deposited energy\"],"
            + "    \"OneToManyRelations\": [\"test::Particle particles // contributing particles\"],"
            + "    \"OneToOneRelations\": [\"test::Track track // track this hit belongs to\"],"
            + "    \"VectorMembers\": [\"float weights // per-particle weights\"]"
            + "  },"
            + "  \"test::Particle\": {"
            + "    \"Members\": [\"int pdg // particle type\"]"
            + "  }"
            + "}}";

    private record Collection(String name, String type, int id, boolean subset, int schemaVersion) {
    }

    private byte[] version = FrameValues.version(0, 17, 0);
    private final Map<String, String> datamodels = new LinkedHashMap<>();
    private final Map<String, CategoryBuilder> categories = new LinkedHashMap<>();
    private final Map<String, byte[]> extraMetadata = new LinkedHashMap<>();
    private CompressionCodec codec = CompressionCodec.UNCOMPRESSED;
    private int basketSize = 2;

    public DatasetWriter version(int major, int minor, int patch) {
        this.version = FrameValues.version(major, minor, patch);
        return this;
    }

    public DatasetWriter withoutVersion() {
        this.version = null;
        return this;
    }

    public DatasetWriter datamodel(String name, String definition) {
        datamodels.put(name, definition);
        return this;
    }

    public DatasetWriter codec(CompressionCodec codec, int basketSize) {
        this.codec = codec;
        this.basketSize = basketSize;
        return this;
    }

    /**
     * Adds or replaces a raw column of the metadata tree.
     */
    public DatasetWriter metadataColumn(String name, byte[] value) {
        extraMetadata.put(name, value);
        return this;
    }

    public CategoryBuilder category(String name) {
        return categories.computeIfAbsent(name, CategoryBuilder::new);
    }

    public class CategoryBuilder {

        private final String name;
        private final List<Collection> collections = new ArrayList<>();
        private final Set<String> columns = new LinkedHashSet<>();
        private final Set<String> columnsWithoutBaskets = new HashSet<>();
        private final List<Map<String, byte[]>> entries = new ArrayList<>();
        private boolean withSchemaVersions = true;
        private boolean withMetadata = true;
        private boolean withTree = true;

        private CategoryBuilder(String name) {
            this.name = name;
        }

        public CategoryBuilder collection(String collection, String type, int id, int schemaVersion) {
            collections.add(new Collection(collection, type, id, false, schemaVersion));
            return this;
        }

        public CategoryBuilder subsetCollection(String collection, String type, int id, int schemaVersion) {
            collections.add(new Collection(collection, type, id, true, schemaVersion));
            return this;
        }

        /**
         * Declares a column of the category tree, so that it is written even if no entry has a value for it.
         */
        public CategoryBuilder column(String column) {
            columns.add(column);
            return this;
        }

        /**
         * Adds an entry holding the given column values; columns without a value hold an empty value.
         */
        public CategoryBuilder entry(Map<String, byte[]> values) {
            columns.addAll(values.keySet());
            entries.add(values);
            return this;
        }

        public CategoryBuilder entries(int count, IntFunction<Map<String, byte[]>> values) {
            for (int i = 0; i < count; i++) {
                entry(values.apply(i));
            }
            return this;
        }

        /**
         * Writes the given column of the category tree without any baskets.
         */
        public CategoryBuilder withoutBaskets(String column) {
            columns.add(column);
            columnsWithoutBaskets.add(column);
            return this;
        }

        public CategoryBuilder withoutSchemaVersions() {
            this.withSchemaVersions = false;
            return this;
        }

        /**
         * Writes the category tree but no collection metadata for it.
         */
        public CategoryBuilder withoutMetadata() {
            this.withMetadata = false;
            return this;
        }

        /**
         * Writes collection metadata for the category but no tree.
         */
        public CategoryBuilder withoutTree() {
            this.withTree = false;
            return this;
        }

        public DatasetWriter done() {
            return DatasetWriter.this;
        }

        private byte[] idTable() {
            return FrameValues.idTable(collections.stream().map(Collection::id).toList(),
                    collections.stream().map(Collection::name).toList());
        }

        private byte[] typeInfo() {
            return FrameValues.collectionTypeInfo(
                    collections.stream().map(Collection::name).toList(),
                    collections.stream().map(Collection::type).toList(),
                    collections.stream().map(Collection::subset).toList(),
                    withSchemaVersions ? collections.stream().map(Collection::schemaVersion).toList() : null);
        }
    }

    public byte[] toByteArray() {
        FrameFileWriter writer = new FrameFileWriter();

        Map<String, byte[]> metadata = new LinkedHashMap<>();
        if (version != null) {
            metadata.put("BuildVersion", version);
        }
        metadata.put("EDMDefinitions", FrameValues.datamodelDefinitions(datamodels));
        for (CategoryBuilder category : categories.values()) {
            if (category.withMetadata) {
                metadata.put(category.name + "___idTable", category.idTable());
                metadata.put(category.name + "___CollectionTypeInfo", category.typeInfo());
            }
        }
        metadata.putAll(extraMetadata);

        FrameFileWriter.TreeBuilder metadataTree = writer.tree(METADATA_TREE, 1);
        metadata.forEach((column, value) -> metadataTree.column(column, List.of(value)));

        for (CategoryBuilder category : categories.values()) {
            if (!category.withTree) {
                continue;
            }
            FrameFileWriter.TreeBuilder tree = writer.tree(category.name, category.entries.size());
            for (String column : category.columns) {
                List<byte[]> values = new ArrayList<>(category.entries.size());
                if (!category.columnsWithoutBaskets.contains(column)) {
                    for (Map<String, byte[]> entry : category.entries) {
                        values.add(entry.getOrDefault(column, new byte[0]));
                    }
                }
                tree.column(column, codec, values, basketSize);
            }
        }
        return writer.toByteArray();
    }

    public Path write(Path file) throws IOException {
        Files.write(file, toByteArray());
        return file;
    }
}
