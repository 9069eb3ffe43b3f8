package com.ruchira.nest.exception;

import lombok.Getter;

/**
 * Exception for nesting transformation errors
 * Carries the offending detail (usually a field name) and a human-readable reason,
 * so that front ends can render every transformation error the same way
 */
@Getter
public abstract class TransformationException extends BusinessException {

    private final String detail;
    private final String reason;

    protected TransformationException(String detail, String reason) {
        super(String.format("%s: %s", detail, reason));
        this.detail = detail;
        this.reason = reason;
    }

}
