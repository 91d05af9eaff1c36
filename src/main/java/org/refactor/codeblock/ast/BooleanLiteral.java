package org.refactor.codeblock.ast;

public record BooleanLiteral(boolean value) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBoolean(this);
    }
}
