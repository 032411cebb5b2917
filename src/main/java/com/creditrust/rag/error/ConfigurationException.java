package com.creditrust.rag.error;

/**
 * Invalid parameter ranges or incompatible settings. Fatal at startup; values
 * are never coerced into a valid range.
 */
public class ConfigurationException extends RagException {

    public ConfigurationException(String message) {
        super(message);
    }
}
