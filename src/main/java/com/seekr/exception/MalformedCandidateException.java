package com.seekr.exception;

/**
 * 单个候选数据异常(非致命,候选被丢弃)
 *
 * @author seekr
 */
public class MalformedCandidateException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final Long chunkId;

    public MalformedCandidateException(Long chunkId, String message) {
        super(message);
        this.chunkId = chunkId;
    }

    public Long getChunkId() {
        return chunkId;
    }
}
