package com.bank.fraudshield.engine.schema;

/**
 * What the validator does with keys that are not part of the schema.
 */
public enum ExtraFeaturePolicy {
    /** Reject the request with a schema violation listing the extra keys. */
    REJECT,
    /** Drop the extra keys and log a warning (forward-compatible clients). */
    DROP
}
