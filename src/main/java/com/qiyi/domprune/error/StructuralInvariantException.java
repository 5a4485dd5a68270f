package com.qiyi.domprune.error;

/**
 * 输入不是一棵严格的树：节点缺少通往根的有效祖先链、存在环，或快照没有唯一根元素。
 */
public class StructuralInvariantException extends DomPruneException {

    public StructuralInvariantException(String message) {
        super(ErrorKind.STRUCTURAL_INVARIANT_VIOLATION, message);
    }

    public StructuralInvariantException(String message, Throwable cause) {
        super(ErrorKind.STRUCTURAL_INVARIANT_VIOLATION, message, cause);
    }
}
