/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.metadata;

/**
 * A datamodel definition (JSON text) stored in a file under the datamodel's name.
 */
public record DatamodelDefinition(String name, String definition) {
}
