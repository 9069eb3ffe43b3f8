package com.ruchira.nest.exception;

/**
 * Base exception for all business logic related errors
 * Every failure caused by caller input is reported through a subtype of this class
 */
public class BusinessException extends RuntimeException {


    public BusinessException(String message) {
        super(message);
    }

    public BusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}
