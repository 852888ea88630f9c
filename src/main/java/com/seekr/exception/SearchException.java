package com.seekr.exception;

import com.seekr.model.dto.RetrievalStage;

/**
 * 检索失败异常
 *
 * <p>检索调用方能看到的唯一致命异常,携带错误类型、失败阶段和原始原因。</p>
 *
 * @author seekr
 */
public class SearchException extends BusinessException {

    private static final long serialVersionUID = 1L;

    private final SearchErrorKind kind;
    private final RetrievalStage stage;

    public SearchException(SearchErrorKind kind, RetrievalStage stage, String message, Throwable cause) {
        super(kind.getErrorCode(), message, cause);
        this.kind = kind;
        this.stage = stage;
    }

    public SearchErrorKind getKind() {
        return kind;
    }

    public RetrievalStage getStage() {
        return stage;
    }
}
