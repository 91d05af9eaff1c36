package org.refactor.codeblock.ast;

public record NumberLiteral(Number value) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }
}
