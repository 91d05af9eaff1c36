package org.refactor.codeblock.analysis;

public enum StatementKind {
    NONE,
    EXPRESSION,
    LITERAL,
    COLLECTION,
    ASSIGNMENT_VAR,
    FUNC_DECLARATION
}
