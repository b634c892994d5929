package com.netai.insights.exception;

/**
 * The batch is too small to impute, scale and fit on.
 */
public class InsufficientDataException extends DetectionException {

    private final int recordCount;
    private final int minimumRequired;

    public InsufficientDataException(int recordCount, int minimumRequired) {
        super(String.format("Insufficient data: %d records, at least %d required", recordCount, minimumRequired));
        this.recordCount = recordCount;
        this.minimumRequired = minimumRequired;
    }

    public int getRecordCount() {
        return recordCount;
    }

    public int getMinimumRequired() {
        return minimumRequired;
    }
}
