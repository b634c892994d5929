package com.netai.insights.exception;

/**
 * Min-max normalization was asked to rescale scores whose range is zero.
 */
public class DegenerateScaleException extends DetectionException {

    public DegenerateScaleException(double value, int count) {
        super(String.format("Cannot normalize %d scores: all equal to %.6f", count, value));
    }
}
