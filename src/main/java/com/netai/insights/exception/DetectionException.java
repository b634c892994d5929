package com.netai.insights.exception;

/**
 * Base type for failures raised by the detection and persistence pipeline.
 */
public class DetectionException extends RuntimeException {

    public DetectionException(String message) {
        super(message);
    }

    public DetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
