package org.refactor.codeblock.parser;

/**
 * 解析错误；行列从 1 开始，未知时为 -1
 */
public record Diagnostic(String message, int line, int column) {

    public Diagnostic(String message) {
        this(message, -1, -1);
    }

    @Override
    public String toString() {
        return line < 0 ? message : "Line " + line + ", column " + column + ": " + message;
    }
}
