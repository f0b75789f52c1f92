package com.bank.fraudshield.engine.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical, versioned feature schema of a model bundle.
 */
public final class FeatureSchema {

    private final String version;
    private final List<FeatureDefinition> features;
    private final List<String> names;
    private final Map<String, Integer> indexByName;

    public FeatureSchema(String version, List<FeatureDefinition> features) {
        this.version = version;
        this.features = List.copyOf(features);
        List<String> orderedNames = new ArrayList<>(features.size());
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < features.size(); i++) {
            String name = features.get(i).getName();
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Feature at position " + i + " has no name");
            }
            if (index.putIfAbsent(name, i) != null) {
                throw new IllegalArgumentException("Duplicate feature name: " + name);
            }
            orderedNames.add(name);
        }
        this.names = Collections.unmodifiableList(orderedNames);
        this.indexByName = Collections.unmodifiableMap(index);
    }

    public String getVersion() {
        return version;
    }

    public int size() {
        return features.size();
    }

    public List<String> getNames() {
        return names;
    }

    public FeatureDefinition getFeature(int index) {
        return features.get(index);
    }

    /** Returns -1 when the name is not part of the schema. */
    public int indexOf(String name) {
        return indexByName.getOrDefault(name, -1);
    }

    public boolean contains(String name) {
        return indexByName.containsKey(name);
    }
}
