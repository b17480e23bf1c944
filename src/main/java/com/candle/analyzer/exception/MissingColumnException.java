package com.candle.analyzer.exception;

import lombok.Getter;

import java.util.List;

/**
 * A required input field is absent. Not recoverable.
 */
@Getter
public class MissingColumnException extends AnalysisException {

    private static final String DEFAULT_ERROR_CODE = "ERR-COL-001";

    private final List<String> columns;

    public MissingColumnException(String... columns) {
        this(List.of(columns));
    }

    public MissingColumnException(List<String> columns) {
        super("Missing required columns: " + columns);
        this.columns = List.copyOf(columns);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
