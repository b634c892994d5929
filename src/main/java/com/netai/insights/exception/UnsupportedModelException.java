package com.netai.insights.exception;

public class UnsupportedModelException extends DetectionException {

    public UnsupportedModelException(String selector) {
        super("Unknown model type: " + selector
                + " (supported: isolation_forest, one_class_svm, dbscan)");
    }
}
