/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.datamodel;

import java.util.List;

/**
 * Names of the relations and vector members of one datatype, in storage order.
 */
public record RelationNames(List<String> relations, List<String> vectorMembers) {

    public static final RelationNames NONE = new RelationNames(List.of(), List.of());
}
