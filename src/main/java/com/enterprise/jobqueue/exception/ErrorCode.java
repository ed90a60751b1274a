package com.enterprise.jobqueue.exception;

/**
 * Error codes surfaced to the admin REST layer
 */
public enum ErrorCode {
    BAD_REQUEST("ERR_BAD_REQUEST"),
    NOT_FOUND("ERR_NOT_FOUND"),
    INTERNAL("ERR_INTERNAL");
    
    private final String code;
    
    ErrorCode(String code) {
        this.code = code;
    }
    
    public String getCode() {
        return code;
    }
}
