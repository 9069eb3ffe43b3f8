package com.ruchira.nest.exception;

import static com.ruchira.nest.constant.Constants.NO_SUCH_NESTING_LEVEL;

/**
 * Raised when a record does not contain one of the requested nesting levels.
 */
public class MissingFieldException extends TransformationException {

    public MissingFieldException(String fieldName) {
        super(fieldName, NO_SUCH_NESTING_LEVEL);
    }

    public String getFieldName() {
        return getDetail();
    }
}
