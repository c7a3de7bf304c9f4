/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.framewood.frame;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Key/value parameters attached to a single frame. Values are lists; a scalar parameter is a list of
 * size one.
 */
public final class GenericParameters {

    private static final GenericParameters EMPTY = new GenericParameters(Map.of(), Map.of(), Map.of(), Map.of());

    private final Map<String, List<Integer>> ints;
    private final Map<String, List<Float>> floats;
    private final Map<String, List<Double>> doubles;
    private final Map<String, List<String>> strings;

    public GenericParameters(Map<String, List<Integer>> ints, Map<String, List<Float>> floats,
                             Map<String, List<Double>> doubles, Map<String, List<String>> strings) {
        this.ints = copy(ints);
        this.floats = copy(floats);
        this.doubles = copy(doubles);
        this.strings = copy(strings);
    }

    public static GenericParameters empty() {
        return EMPTY;
    }

    private static <T> Map<String, List<T>> copy(Map<String, List<T>> source) {
        Map<String, List<T>> copy = new LinkedHashMap<>();
        source.forEach((key, values) -> copy.put(key, List.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }

    public List<Integer> getInts(String key) {
        return ints.getOrDefault(key, List.of());
    }

    public List<Float> getFloats(String key) {
        return floats.getOrDefault(key, List.of());
    }

    public List<Double> getDoubles(String key) {
        return doubles.getOrDefault(key, List.of());
    }

    public List<String> getStrings(String key) {
        return strings.getOrDefault(key, List.of());
    }

    public Set<String> getIntKeys() {
        return ints.keySet();
    }

    public Set<String> getFloatKeys() {
        return floats.keySet();
    }

    public Set<String> getDoubleKeys() {
        return doubles.keySet();
    }

    public Set<String> getStringKeys() {
        return strings.keySet();
    }

    public boolean isEmpty() {
        return ints.isEmpty() && floats.isEmpty() && doubles.isEmpty() && strings.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GenericParameters other)) {
            return false;
        }
        return ints.equals(other.ints) && floats.equals(other.floats)
                && doubles.equals(other.doubles) && strings.equals(other.strings);
    }

    @Override
    public int hashCode() {
        return ints.hashCode() * 31 * 31 * 31 + floats.hashCode() * 31 * 31 + doubles.hashCode() * 31 + strings.hashCode();
    }

    @Override
    public String toString() {
        return "GenericParameters[ints=" + ints + ", floats=" + floats + ", doubles=" + doubles + ", strings=" + strings + "]";
    }
}
