package com.candle.analyzer.exception;

import lombok.Getter;

/**
 * Too few bars to produce any analyzable row.
 */
@Getter
public class InsufficientHistoryException extends AnalysisException {

    private static final String DEFAULT_ERROR_CODE = "ERR-HIST-001";

    private final int available;
    private final int required;

    public InsufficientHistoryException(int available, int required) {
        super(String.format("Not enough bars: have %d, need at least %d", available, required));
        this.available = available;
        this.required = required;
    }

    public InsufficientHistoryException(String message, int available, int required) {
        super(message);
        this.available = available;
        this.required = required;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
