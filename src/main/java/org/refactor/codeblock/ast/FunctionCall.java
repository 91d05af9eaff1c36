package org.refactor.codeblock.ast;

import java.util.List;

/**
 * 函数调用；运算符也会被解析器降级为 {@code %add(a, b)} 这样的调用。
 */
public record FunctionCall(String name, List<AstNode> arguments) implements AstNode {

    public FunctionCall {
        arguments = List.copyOf(arguments);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
