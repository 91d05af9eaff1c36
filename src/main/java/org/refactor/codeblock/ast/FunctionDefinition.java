package org.refactor.codeblock.ast;

import java.util.List;

/**
 * {@code def name(p1, p2) { body }}
 *
 * @param bodyEndLine 函数体结束行，未知时为 -1
 */
public record FunctionDefinition(String name, List<String> parameters, List<AstNode> body,
                                 int line, int endLine, int bodyEndLine) implements AstNode {

    public FunctionDefinition {
        parameters = List.copyOf(parameters);
        body = List.copyOf(body);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunctionDefinition(this);
    }
}
