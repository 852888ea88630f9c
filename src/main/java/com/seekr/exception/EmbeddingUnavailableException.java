package com.seekr.exception;

/**
 * 嵌入服务不可达
 *
 * @author seekr
 */
public class EmbeddingUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
