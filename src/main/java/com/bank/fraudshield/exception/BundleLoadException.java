package com.bank.fraudshield.exception;

/**
 * The model bundle is missing, unreadable or inconsistent. Fatal at startup.
 */
public class BundleLoadException extends EngineException {

    public static final String ERROR_CODE = "ERR-BUNDLE-001";

    public BundleLoadException(String message) {
        super(ERROR_CODE, message);
    }

    public BundleLoadException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }

    @Override
    public String getErrorType() {
        return "BundleLoadError";
    }
}
