/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.datamodel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import dev.framewood.metadata.DatamodelDefinition;

/**
 * Holds the datamodel definitions read from a file, keyed by datamodel name.
 */
public class DatamodelDefinitionHolder {

    /**
     * Definition returned for datamodels that are not stored in the file.
     */
    public static final String EMPTY_DEFINITION = "{}";

    private final Map<String, String> definitions;

    public DatamodelDefinitionHolder(List<DatamodelDefinition> definitions) {
        Map<String, String> byName = new LinkedHashMap<>();
        for (DatamodelDefinition definition : definitions) {
            byName.put(definition.name(), definition.definition());
        }
        this.definitions = Collections.unmodifiableMap(byName);
    }

    public String getDatamodelDefinition(String name) {
        return definitions.getOrDefault(name, EMPTY_DEFINITION);
    }

    public List<String> getAvailableDatamodels() {
        return new ArrayList<>(definitions.keySet());
    }

    Map<String, String> definitions() {
        return definitions;
    }
}
