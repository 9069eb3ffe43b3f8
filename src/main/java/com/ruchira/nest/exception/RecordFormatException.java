package com.ruchira.nest.exception;

import lombok.Getter;

/**
 * Exception for flat records that cannot be decoded from their serialized form
 */
@Getter
public class RecordFormatException extends BusinessException {

    private final String detail;
    private final String reason;

    public RecordFormatException(String detail, String reason, Throwable cause) {
        super(String.format("%s: %s", detail, reason), cause);
        this.detail = detail;
        this.reason = reason;
    }

    public RecordFormatException(String detail, String reason) {
        this(detail, reason, null);
    }
}
