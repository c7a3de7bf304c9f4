/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.datamodel;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Knows, per datatype, which relation and vector member columns accompany a collection's payload.
 * <p>
 * Built from the JSON datamodel definitions stored in a file. Every datatype lists its members as
 * strings of the form {@code "<type> <name> // <description>"} under {@code OneToManyRelations},
 * {@code OneToOneRelations} and {@code VectorMembers}. One-to-many relations are stored before
 * one-to-one relations.
 * </p>
 */
public class DatamodelRegistry {

    private static final System.Logger LOG = System.getLogger(DatamodelRegistry.class.getName());

    private static final String COLLECTION_SUFFIX = "Collection";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, RelationNames> relationNamesByType;
    private final Set<String> reportedUnknownTypes = new HashSet<>();

    private DatamodelRegistry(Map<String, RelationNames> relationNamesByType) {
        this.relationNamesByType = relationNamesByType;
    }

    /**
     * Parses all definitions of the given holder.
     *
     * @throws IOException if a definition is not valid JSON
     */
    public static DatamodelRegistry from(DatamodelDefinitionHolder holder) throws IOException {
        Map<String, RelationNames> byType = new HashMap<>();
        for (Map.Entry<String, String> definition : holder.definitions().entrySet()) {
            JsonNode root;
            try {
                root = MAPPER.readTree(definition.getValue());
            }
            catch (JsonProcessingException e) {
                throw new IOException("Invalid definition for datamodel '" + definition.getKey() + "'", e);
            }
            JsonNode datatypes = root.path("datatypes");
            Iterator<Map.Entry<String, JsonNode>> fields = datatypes.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> datatype = fields.next();
                List<String> relations = new ArrayList<>(memberNames(datatype.getValue().path("OneToManyRelations")));
                relations.addAll(memberNames(datatype.getValue().path("OneToOneRelations")));
                List<String> vectorMembers = memberNames(datatype.getValue().path("VectorMembers"));
                byType.put(datatype.getKey(), new RelationNames(List.copyOf(relations), vectorMembers));
            }
        }
        return new DatamodelRegistry(byType);
    }

    /**
     * Returns the relation and vector member names of the given collection type. Collection types
     * are accepted both as {@code X} and as {@code XCollection}.
     * Unknown types have neither relations nor vector members.
     */
    public RelationNames getRelationNames(String collectionType) {
        RelationNames names = relationNamesByType.get(collectionType);
        if (names == null && collectionType.endsWith(COLLECTION_SUFFIX)) {
            names = relationNamesByType.get(collectionType.substring(0, collectionType.length() - COLLECTION_SUFFIX.length()));
        }
        if (names == null) {
            if (reportedUnknownTypes.add(collectionType)) {
                LOG.log(System.Logger.Level.WARNING,
                        "No datamodel definition found for collection type ''{0}'', reading its payload only", collectionType);
            }
            return RelationNames.NONE;
        }
        return names;
    }

    public boolean isKnownType(String collectionType) {
        return relationNamesByType.containsKey(collectionType)
                || (collectionType.endsWith(COLLECTION_SUFFIX)
                        && relationNamesByType.containsKey(collectionType.substring(0, collectionType.length() - COLLECTION_SUFFIX.length())));
    }

    private static List<String> memberNames(JsonNode members) {
        List<String> names = new ArrayList<>();
        for (JsonNode member : members) {
            String declaration = member.asText();
            int comment = declaration.indexOf("//");
            if (comment >= 0) {
                declaration = declaration.substring(0, comment);
            }
            String[] tokens = declaration.trim().split("\\s+");
            if (!tokens[tokens.length - 1].isEmpty()) {
                names.add(tokens[tokens.length - 1]);
            }
        }
        return List.copyOf(names);
    }
}
