package com.salesagent.leads.exception;

/**
 * A raw record failed validation. Scoped to that record; the batch goes on.
 */
public class RecordValidationException extends RuntimeException {

    public RecordValidationException(String message) {
        super(message);
    }
}
