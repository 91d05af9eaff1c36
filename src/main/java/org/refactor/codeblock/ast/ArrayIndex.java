package org.refactor.codeblock.ast;

public record ArrayIndex(AstNode base, AstNode index) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitArrayIndex(this);
    }
}
