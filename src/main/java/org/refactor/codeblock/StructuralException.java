package org.refactor.codeblock;

/**
 * 顶层 AST 节点既不是赋值也不是函数定义：说明解析器与分析器不匹配，属于内部错误。
 */
public class StructuralException extends IllegalArgumentException {

    public StructuralException(String message) {
        super(message);
    }
}
