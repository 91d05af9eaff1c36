package org.refactor.codeblock.ast;

public record NullLiteral() implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitNull(this);
    }
}
