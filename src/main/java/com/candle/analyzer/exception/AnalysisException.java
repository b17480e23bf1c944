package com.candle.analyzer.exception;

import lombok.Getter;

/**
 * Base class for failures raised by the analysis pipeline.
 */
@Getter
public abstract class AnalysisException extends RuntimeException {

    private final String errorCode;

    protected AnalysisException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected abstract String getDefaultErrorCode();
}
