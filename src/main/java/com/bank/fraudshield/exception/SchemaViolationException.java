package com.bank.fraudshield.exception;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Input did not match the feature schema. Lists every offending field so the
 * caller can fix everything in one round trip.
 */
public class SchemaViolationException extends EngineException {

    public static final String ERROR_CODE = "ERR-SCHEMA-001";

    private final List<String> missing;
    private final List<String> extra;
    private final List<String> nonNumeric;

    public SchemaViolationException(List<String> missing, List<String> extra, List<String> nonNumeric) {
        super(ERROR_CODE, buildMessage(missing, extra, nonNumeric));
        this.missing = List.copyOf(missing);
        this.extra = List.copyOf(extra);
        this.nonNumeric = List.copyOf(nonNumeric);
    }

    public List<String> getMissing() {
        return missing;
    }

    public List<String> getExtra() {
        return extra;
    }

    public List<String> getNonNumeric() {
        return nonNumeric;
    }

    @Override
    public String getErrorType() {
        return "SchemaViolation";
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("missing", missing);
        details.put("extra", extra);
        details.put("nonNumeric", nonNumeric);
        return details;
    }

    private static String buildMessage(List<String> missing, List<String> extra, List<String> nonNumeric) {
        return String.format("Feature schema violation: %d missing, %d extra, %d non-numeric",
                missing.size(), extra.size(), nonNumeric.size());
    }
}
