package com.bank.fraudshield.engine.schema;

import com.bank.fraudshield.exception.SchemaViolationException;
import com.bank.fraudshield.model.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts a loosely typed key/value map into a {@link FeatureVector} in the
 * schema's canonical order. Collects every problem before failing.
 */
public class FeatureContractValidator {

    private static final Logger log = LoggerFactory.getLogger(FeatureContractValidator.class);

    private final FeatureSchema schema;

    public FeatureContractValidator(FeatureSchema schema) {
        this.schema = schema;
    }

    public FeatureVector validate(Map<String, ?> input, ExtraFeaturePolicy extraPolicy) {
        List<String> missing = new ArrayList<>();
        List<String> extra = new ArrayList<>();
        List<String> nonNumeric = new ArrayList<>();

        Map<String, ?> raw = input != null ? input : Map.of();
        double[] values = new double[schema.size()];

        for (int i = 0; i < schema.size(); i++) {
            String name = schema.getNames().get(i);
            if (!raw.containsKey(name)) {
                missing.add(name);
                continue;
            }
            Double parsed = toFiniteDouble(raw.get(name));
            if (parsed == null) {
                nonNumeric.add(name);
            } else {
                values[i] = parsed;
            }
        }

        for (String key : raw.keySet()) {
            if (!schema.contains(key)) {
                extra.add(key);
            }
        }

        if (!extra.isEmpty() && extraPolicy == ExtraFeaturePolicy.DROP) {
            log.warn("Dropping {} unknown feature(s) not in schema {}: {}",
                    extra.size(), schema.getVersion(), extra);
            extra = List.of();
        }

        if (!missing.isEmpty() || !extra.isEmpty() || !nonNumeric.isEmpty()) {
            throw new SchemaViolationException(missing, extra, nonNumeric);
        }

        return new FeatureVector(schema.getVersion(), schema.getNames(), values);
    }

    /**
     * Numbers and numeric strings are accepted. Booleans, nulls, NaN and
     * infinities are not.
     */
    static Double toFiniteDouble(Object value) {
        double d;
        if (value instanceof Number n) {
            d = n.doubleValue();
        } else if (value instanceof String s) {
            try {
                d = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(d) ? d : null;
    }
}
