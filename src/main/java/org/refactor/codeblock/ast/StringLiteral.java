package org.refactor.codeblock.ast;

public record StringLiteral(String value) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitString(this);
    }
}
