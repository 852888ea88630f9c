package com.seekr.exception;

/**
 * 业务错误码
 *
 * @author seekr
 */
public enum ErrorCode {
    VALIDATION_ERROR("E400"),
    NOT_FOUND("E404"),
    CONFLICT("E409"),
    SEARCH_FAILED("E500-SEARCH"),
    SEARCH_TIMEOUT("E504"),
    INTERNAL_ERROR("E500");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
