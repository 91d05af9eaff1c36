package org.refactor.codeblock;

/**
 * 用户可以通过继续编辑代码来恢复的错误（语法错误、重复定义）。
 */
public abstract class CodeBlockException extends Exception {

    protected CodeBlockException(String message) {
        super(message);
    }
}
