package com.textforge.formatter.exception;

public class InvalidFormatterConfigException extends Exception {

    private final String field;

    public InvalidFormatterConfigException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
