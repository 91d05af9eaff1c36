package org.refactor.codeblock.ast;

import java.util.List;

public record CollectionLiteral(List<AstNode> elements) implements AstNode {

    public CollectionLiteral {
        elements = List.copyOf(elements);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCollection(this);
    }
}
