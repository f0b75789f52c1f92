package com.bank.fraudshield.model;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated, dense feature vector in the canonical order of the schema it was
 * checked against. Instances are only created by the feature contract validator
 * (or tests) and never change afterwards.
 */
public final class FeatureVector {

    private final String schemaVersion;
    private final List<String> names;
    private final double[] values;

    public FeatureVector(String schemaVersion, List<String> names, double[] values) {
        if (names.size() != values.length) {
            throw new IllegalArgumentException(
                    "Feature name count " + names.size() + " does not match value count " + values.length);
        }
        this.schemaVersion = schemaVersion;
        this.names = List.copyOf(names);
        this.values = Arrays.copyOf(values, values.length);
    }

    public String getSchemaVersion() {
        return schemaVersion;
    }

    public List<String> getNames() {
        return names;
    }

    public int size() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    /** Copy of the raw values in canonical order. */
    public double[] toArray() {
        return Arrays.copyOf(values, values.length);
    }

    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(names.get(i), values[i]);
        }
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureVector other)) return false;
        return schemaVersion.equals(other.schemaVersion)
                && names.equals(other.names)
                && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * names.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector{schema=" + schemaVersion + ", size=" + values.length + "}";
    }
}
