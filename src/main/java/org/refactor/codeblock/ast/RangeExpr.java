package org.refactor.codeblock.ast;

/**
 * {@code from..to..step}；step 可以为 null。
 */
public record RangeExpr(AstNode from, AstNode to, AstNode step) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitRange(this);
    }
}
