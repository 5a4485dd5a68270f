package com.qiyi.domprune.error;

/**
 * 压缩/剪枝引擎的统一异常基类。
 * 引擎内部不重试、不降级，由调用方决定中止当前步骤、回退到未剪枝表示或跳过出错的候选。
 */
public class DomPruneException extends RuntimeException {

    public enum ErrorKind {
        NOT_FOUND,
        MALFORMED_LETTER_CODE,
        STRUCTURAL_INVARIANT_VIOLATION
    }

    private final ErrorKind kind;

    public DomPruneException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DomPruneException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
