package org.refactor.codeblock.ast;

/**
 * {@code target.f(args)}，调用目标作为内部调用的第一个参数。
 */
public record DotCall(FunctionCall call) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitDotCall(this);
    }
}
