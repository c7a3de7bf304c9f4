/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.reader;

import java.util.ArrayList;
import java.util.List;

import dev.framewood.internal.datamodel.RelationNames;
import dev.framewood.metadata.Version;

/**
 * Naming rules for the trees and columns of a frame dataset.
 * <p>
 * Since build version 0.17.0 relation and vector member columns are named after the relation
 * ({@code _<collection>_<relation>}). Older files number them instead: relations are
 * {@code <collection>#<i>} and vector members {@code <collection>_<relationCount + i>}.
 * </p>
 */
public final class BranchNames {

    public static final String METADATA_TREE = "frame_metadata";
    public static final String PARAMETERS = "PARAMETERS";
    public static final String BUILD_VERSION = "BuildVersion";
    public static final String EDM_DEFINITIONS = "EDMDefinitions";

    public static final String ID_TABLE_SUFFIX = "___idTable";
    public static final String COLLECTION_INFO_SUFFIX = "___CollectionTypeInfo";

    public static final Version NAMED_RELATIONS_SINCE = new Version(0, 17, 0);

    private BranchNames() {
    }

    /**
     * The columns holding one collection's buffers.
     *
     * @param data the payload column, or null for subset collections
     * @param references the relation columns (for subset collections, the single object ID column)
     * @param vectorMembers the vector member columns
     */
    public record BranchColumns(String data, List<String> references, List<String> vectorMembers) {
    }

    public static String idTable(String category) {
        return category + ID_TABLE_SUFFIX;
    }

    public static String collectionTypeInfo(String category) {
        return category + COLLECTION_INFO_SUFFIX;
    }

    public static String subset(String collection) {
        return collection + "_objIdx";
    }

    public static String relation(String collection, String relation) {
        return "_" + collection + "_" + relation;
    }

    public static String relation(String collection, int index) {
        return collection + "#" + index;
    }

    public static String vectorMember(String collection, String member) {
        return "_" + collection + "_" + member;
    }

    public static String vectorMember(String collection, int index) {
        return collection + "_" + index;
    }

    public static boolean usesIndexBasedNames(Version fileVersion) {
        return !fileVersion.isAtLeast(NAMED_RELATIONS_SINCE);
    }

    public static BranchColumns columnsFor(String collection, boolean subset, RelationNames names, Version fileVersion) {
        if (subset) {
            return new BranchColumns(null, List.of(subset(collection)), List.of());
        }

        boolean indexBased = usesIndexBasedNames(fileVersion);
        List<String> references = new ArrayList<>(names.relations().size());
        for (int i = 0; i < names.relations().size(); i++) {
            references.add(indexBased ? relation(collection, i) : relation(collection, names.relations().get(i)));
        }
        List<String> vectorMembers = new ArrayList<>(names.vectorMembers().size());
        for (int i = 0; i < names.vectorMembers().size(); i++) {
            vectorMembers.add(indexBased
                    ? vectorMember(collection, references.size() + i)
                    : vectorMember(collection, names.vectorMembers().get(i)));
        }
        return new BranchColumns(collection, List.copyOf(references), List.copyOf(vectorMembers));
    }
}
