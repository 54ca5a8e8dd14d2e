package com.lf2x.config;

public final class MissingFieldException extends FlowExportException {
    private final String field;

    public MissingFieldException(String field) {
        this(field, "Missing required field '" + field + "'");
    }

    public MissingFieldException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
