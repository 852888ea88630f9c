package com.seekr.exception;

/**
 * 业务异常基类
 *
 * @author seekr
 */
public class BusinessException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public static BusinessException invalid(String msg) {
        return new BusinessException(ErrorCode.VALIDATION_ERROR, msg);
    }

    public static BusinessException notFound(String msg) {
        return new BusinessException(ErrorCode.NOT_FOUND, msg);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
