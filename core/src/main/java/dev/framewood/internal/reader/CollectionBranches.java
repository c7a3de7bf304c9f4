/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.internal.reader;

import java.util.List;

/**
 * The resolved column handles of one collection within one segment.
 *
 * @param data handle on the payload column, or null for subset collections and the parameters slot
 * @param references handles on the relation columns
 * @param vectorMembers handles on the vector member columns
 */
public record CollectionBranches(
        ColumnHandle data,
        List<ColumnHandle> references,
        List<ColumnHandle> vectorMembers) {
}
