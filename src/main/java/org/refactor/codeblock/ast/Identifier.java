package org.refactor.codeblock.ast;

/**
 * 标识符出现位置（行列均从 1 开始）。
 *
 * @param arrayIndex 紧跟在标识符后的下标表达式，没有时为 null
 */
public record Identifier(String name, int line, int column, AstNode arrayIndex) implements AstNode {

    public Identifier(String name, int line, int column) {
        this(name, line, column, null);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
