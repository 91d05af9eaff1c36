package org.refactor.codeblock.ast;

/**
 * 代码块语言的 AST 节点（封闭类型）
 * <p>
 * 新增节点形状时必须同时扩展 {@link AstVisitor}，所有访问者都会在编译期被迫补齐。
 */
public sealed interface AstNode
        permits Assignment, FunctionDefinition, Identifier, FunctionCall, DotCall, ArrayIndex,
        CollectionLiteral, Conditional, RangeExpr, NumberLiteral, StringLiteral, BooleanLiteral, NullLiteral {

    <R> R accept(AstVisitor<R> visitor);
}
