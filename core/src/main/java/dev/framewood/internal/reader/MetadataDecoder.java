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
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import dev.framewood.frame.CollectionIDTable;
import dev.framewood.internal.datamodel.DatamodelDefinitionHolder;
import dev.framewood.internal.datamodel.DatamodelRegistry;
import dev.framewood.internal.datamodel.RelationNames;
import dev.framewood.internal.reader.BranchNames.BranchColumns;
import dev.framewood.internal.thrift.CollectionIDTableReader;
import dev.framewood.internal.thrift.CollectionTypeInfoReader;
import dev.framewood.internal.thrift.DatamodelDefinitionsReader;
import dev.framewood.internal.thrift.ThriftCompactReader;
import dev.framewood.internal.thrift.VersionReader;
import dev.framewood.metadata.CollectionTypeInfo;
import dev.framewood.metadata.DatamodelDefinition;
import dev.framewood.metadata.Version;
import dev.framewood.reader.MetadataInconsistencyException;
import dev.framewood.schema.CollectionDescriptor;

/**
 * Decodes the metadata tree of a dataset.
 * <p>
 * The metadata tree holds a single entry, read from the first segment that contains it. It records
 * the build version, the datamodel definitions and, per category, the collection ID table and the
 * collection type information.
 * </p>
 */
public class MetadataDecoder {

    private static final System.Logger LOG = System.getLogger(MetadataDecoder.class.getName());

    @FunctionalInterface
    private interface ValueReader<T> {
        T read(ThriftCompactReader reader) throws IOException;
    }

    private final TreeChain metadataTree;
    private final TreeChain.Location metadataEntry;
    private final Version fileVersion;
    private final DatamodelDefinitionHolder datamodelDefinitions;
    private final DatamodelRegistry datamodelRegistry;

    private MetadataDecoder(TreeChain metadataTree, Version fileVersion,
                            DatamodelDefinitionHolder datamodelDefinitions, DatamodelRegistry datamodelRegistry) {
        this.metadataTree = metadataTree;
        this.metadataEntry = metadataTree.locate(0);
        this.fileVersion = fileVersion;
        this.datamodelDefinitions = datamodelDefinitions;
        this.datamodelRegistry = datamodelRegistry;
    }

    /**
     * Reads the dataset-wide metadata: build version and datamodel definitions.
     *
     * @throws IOException if the dataset has no readable metadata tree
     */
    public static MetadataDecoder open(DatasetBackend backend) throws IOException {
        TreeChain metadataTree = backend.chain(BranchNames.METADATA_TREE);
        if (metadataTree == null || metadataTree.entryCount() == 0) {
            throw new IOException("Dataset has no '" + BranchNames.METADATA_TREE + "' tree");
        }
        TreeChain.Location entry = metadataTree.locate(0);

        Version version = readValue(metadataTree, entry, BranchNames.BUILD_VERSION, VersionReader::read);
        if (version == null) {
            version = Version.UNKNOWN;
        }
        List<DatamodelDefinition> definitions = readValue(metadataTree, entry, BranchNames.EDM_DEFINITIONS,
                DatamodelDefinitionsReader::read);
        DatamodelDefinitionHolder holder = new DatamodelDefinitionHolder(definitions == null ? List.of() : definitions);

        LOG.log(System.Logger.Level.DEBUG, "Dataset written by version {0}, datamodels {1}",
                version, holder.getAvailableDatamodels());

        return new MetadataDecoder(metadataTree, version, holder, DatamodelRegistry.from(holder));
    }

    private static <T> T readValue(TreeChain tree, TreeChain.Location entry, String column, ValueReader<T> valueReader)
            throws IOException {
        ColumnHandle handle = tree.openColumn(entry.segment(), column);
        if (handle == null) {
            return null;
        }
        ByteBuffer value = handle.read(entry.localEntry());
        return valueReader.read(new ThriftCompactReader(value));
    }

    public Version fileVersion() {
        return fileVersion;
    }

    public DatamodelDefinitionHolder datamodelDefinitions() {
        return datamodelDefinitions;
    }

    /**
     * Names of the categories that have both an ID table and collection type information, in
     * storage order.
     */
    public List<String> availableCategories() {
        List<String> columns = metadataTree.columnNames(metadataEntry.segment());
        Set<String> columnSet = new HashSet<>(columns);
        List<String> categories = new ArrayList<>();
        for (String column : columns) {
            if (column.endsWith(BranchNames.ID_TABLE_SUFFIX)) {
                String category = column.substring(0, column.length() - BranchNames.ID_TABLE_SUFFIX.length());
                if (columnSet.contains(BranchNames.collectionTypeInfo(category))) {
                    categories.add(category);
                }
            }
        }
        return Collections.unmodifiableList(categories);
    }

    /**
     * Decodes the collection descriptors and the collection ID table of the given category.
     *
     * @throws MetadataInconsistencyException if the category's metadata is missing or inconsistent
     * @throws IOException if the metadata cannot be read
     */
    public CategoryMetadata decode(String category) throws IOException {
        ColumnHandle idTableColumn = metadataTree.openColumn(metadataEntry.segment(), BranchNames.idTable(category));
        ColumnHandle typeInfoColumn = metadataTree.openColumn(metadataEntry.segment(), BranchNames.collectionTypeInfo(category));
        if (idTableColumn == null || typeInfoColumn == null) {
            throw new MetadataInconsistencyException(category, "no collection metadata stored for this category");
        }

        CollectionIDTableReader.Entries idEntries;
        CollectionTypeInfo typeInfo;
        ByteBuffer idTableValue = idTableColumn.read(metadataEntry.localEntry());
        ByteBuffer typeInfoValue = typeInfoColumn.read(metadataEntry.localEntry());
        try {
            idEntries = CollectionIDTableReader.read(new ThriftCompactReader(idTableValue));
            typeInfo = CollectionTypeInfoReader.read(new ThriftCompactReader(typeInfoValue));
        }
        catch (IOException e) {
            throw new MetadataInconsistencyException(category, "collection metadata cannot be decoded", e);
        }

        if (idEntries.ids().size() != idEntries.names().size()) {
            throw new MetadataInconsistencyException(category, "collection ID table has " + idEntries.ids().size()
                    + " ids but " + idEntries.names().size() + " names");
        }
        CollectionIDTable idTable = new CollectionIDTable(idEntries.ids(), idEntries.names());

        List<String> names = typeInfo.names();
        List<Integer> schemaVersions = typeInfo.schemaVersions();
        if (schemaVersions == null) {
            if (!BranchNames.usesIndexBasedNames(fileVersion)) {
                throw new MetadataInconsistencyException(category, "no schema versions recorded by a version "
                        + fileVersion + " file");
            }
            schemaVersions = Collections.nCopies(names.size(), 1);
        }
        if (typeInfo.types().size() != names.size()
                || typeInfo.subsetFlags().size() != names.size()
                || schemaVersions.size() != names.size()) {
            throw new MetadataInconsistencyException(category, "declares " + names.size() + " collections but "
                    + typeInfo.types().size() + " types, " + typeInfo.subsetFlags().size() + " subset flags and "
                    + schemaVersions.size() + " schema versions");
        }

        List<CollectionDescriptor> descriptors = new ArrayList<>(names.size());
        List<BranchColumns> columns = new ArrayList<>(names.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            if (!seen.add(name)) {
                throw new MetadataInconsistencyException(category, "collection '" + name + "' is declared twice");
            }
            if (!idTable.isPresent(name)) {
                throw new MetadataInconsistencyException(category, "collection '" + name + "' is missing from the collection ID table");
            }
            String type = typeInfo.types().get(i);
            boolean subset = typeInfo.subsetFlags().get(i);
            RelationNames relationNames = subset ? RelationNames.NONE : datamodelRegistry.getRelationNames(type);

            descriptors.add(new CollectionDescriptor(name, type, subset, schemaVersions.get(i), i));
            columns.add(BranchNames.columnsFor(name, subset, relationNames, fileVersion));
        }

        return new CategoryMetadata(List.copyOf(descriptors), List.copyOf(columns), idTable);
    }
}
