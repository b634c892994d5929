package com.netai.insights.exception;

/**
 * A persisted model bundle is missing or cannot be decoded.
 */
public class ModelLoadException extends DetectionException {

    public ModelLoadException(String message) {
        super(message);
    }

    public ModelLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
