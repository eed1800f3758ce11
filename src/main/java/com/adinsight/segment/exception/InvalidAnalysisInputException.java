package com.adinsight.segment.exception;

/**
 * Input to an analysis is missing a required value. Carries the offending field
 * so the REST layer can point the caller at it.
 */
public class InvalidAnalysisInputException extends IllegalArgumentException {

    private final String field;

    public InvalidAnalysisInputException(String message, String field) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
