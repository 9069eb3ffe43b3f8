package com.ruchira.nest.exception;

/**
 * Raised when the requested nesting levels cannot be used at all,
 * before a single record is processed.
 */
public class NestingConfigurationException extends TransformationException {

    public NestingConfigurationException(String detail, String reason) {
        super(detail, reason);
    }
}
