package org.refactor.codeblock.parser;

/**
 * 代码块语言的解析器：文本进，AST 节点 + 未绑定标识符（或 diagnostics）出。
 */
@FunctionalInterface
public interface CodeParser {

    ParsedBlock parse(String code);
}
