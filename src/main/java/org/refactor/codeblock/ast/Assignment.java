package org.refactor.codeblock.ast;

import java.util.Objects;

/**
 * {@code target = value}；链式赋值 {@code a = b = c} 表示为 value 仍是 Assignment 的右递归结构。
 */
public record Assignment(Identifier target, AstNode value, int line, int endLine) implements AstNode {

    public Assignment {
        Objects.requireNonNull(target);
        Objects.requireNonNull(value);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAssignment(this);
    }
}
