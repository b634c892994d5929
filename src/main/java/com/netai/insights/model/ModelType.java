package com.netai.insights.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.netai.insights.exception.UnsupportedModelException;

import java.util.Arrays;
import java.util.Locale;

/**
 * The closed set of unsupervised detectors. Selector strings are resolved here and nowhere else.
 */
public enum ModelType {
    ISOLATION_FOREST("isolation_forest"),
    ONE_CLASS_SVM("one_class_svm"),
    DBSCAN("dbscan");

    private final String selector;

    ModelType(String selector) {
        this.selector = selector;
    }

    @JsonValue
    public String getSelector() {
        return selector;
    }

    public static ModelType fromSelector(String selector) {
        if (selector == null) {
            throw new UnsupportedModelException("null");
        }
        String normalized = selector.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.selector.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new UnsupportedModelException(selector));
    }
}
