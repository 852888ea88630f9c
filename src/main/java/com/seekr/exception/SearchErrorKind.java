package com.seekr.exception;

/**
 * 检索请求的致命错误类型
 *
 * @author seekr
 */
public enum SearchErrorKind {

    /**
     * 嵌入服务不可用
     */
    EMBEDDING_UNAVAILABLE(ErrorCode.SEARCH_FAILED),

    /**
     * 向量库不可用
     */
    VECTOR_STORE_UNAVAILABLE(ErrorCode.SEARCH_FAILED),

    /**
     * 请求超时(不返回部分结果)
     */
    SEARCH_TIMEOUT(ErrorCode.SEARCH_TIMEOUT);

    private final ErrorCode errorCode;

    SearchErrorKind(ErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
