package org.refactor.codeblock.parser;

import org.refactor.codeblock.ast.AstNode;

import java.util.List;

/**
 * 解析结果：成功时是顶层 AST 节点 + 未绑定标识符，失败时只有 diagnostics。
 *
 * @param source 实际被解析的代码（非赋值语句前插入了合成临时变量）
 */
public record ParsedBlock(List<AstNode> nodes, List<String> freeIdentifiers, String source,
                          List<Diagnostic> diagnostics) {

    public ParsedBlock {
        nodes = List.copyOf(nodes);
        freeIdentifiers = List.copyOf(freeIdentifiers);
        diagnostics = List.copyOf(diagnostics);
    }

    public static ParsedBlock success(List<AstNode> nodes, List<String> freeIdentifiers, String source) {
        return new ParsedBlock(nodes, freeIdentifiers, source, List.of());
    }

    public static ParsedBlock failure(List<Diagnostic> diagnostics) {
        if (diagnostics.isEmpty()) {
            throw new IllegalArgumentException("A failed parse needs at least one diagnostic");
        }
        return new ParsedBlock(List.of(), List.of(), "", diagnostics);
    }

    public boolean isSuccessful() {
        return diagnostics.isEmpty();
    }
}
