package org.refactor.codeblock.ast;

public record Conditional(AstNode condition, AstNode whenTrue, AstNode whenFalse) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }
}
