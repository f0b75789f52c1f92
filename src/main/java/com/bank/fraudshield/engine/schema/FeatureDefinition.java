package com.bank.fraudshield.engine.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One feature of the schema. {@code label} and {@code description} carry the
 * business meaning of engineered features and are optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FeatureDefinition {
    private String name;
    private String label;
    private String description;

    public static FeatureDefinition of(String name) {
        return FeatureDefinition.builder().name(name).build();
    }
}
