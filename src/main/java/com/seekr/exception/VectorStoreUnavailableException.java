package com.seekr.exception;

/**
 * 向量库不可达
 *
 * @author seekr
 */
public class VectorStoreUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public VectorStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
