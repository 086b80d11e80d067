package com.cadenza.compiler;

/**
 * 编译期异常基类
 * <p>所有词法、语法、语义与代码生成错误都沿此层级抛出，核心代码自身不打印诊断。</p>
 */
public class CadenzaException extends RuntimeException {

    public CadenzaException(String message) {
        super(message);
    }

    public CadenzaException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 结构化诊断；无源码位置时行列为 0
     */
    public Diagnostic toDiagnostic() {
        return new Diagnostic(Diagnostic.Severity.ERROR, getMessage(), 0, 0);
    }
}
