package org.refactor.codeblock.ast;

public interface AstVisitor<R> {

    R visitAssignment(Assignment assignment);

    R visitFunctionDefinition(FunctionDefinition definition);

    R visitIdentifier(Identifier identifier);

    R visitFunctionCall(FunctionCall call);

    R visitDotCall(DotCall dotCall);

    R visitArrayIndex(ArrayIndex arrayIndex);

    R visitCollection(CollectionLiteral collection);

    R visitConditional(Conditional conditional);

    R visitRange(RangeExpr range);

    R visitNumber(NumberLiteral number);

    R visitString(StringLiteral string);

    R visitBoolean(BooleanLiteral bool);

    R visitNull(NullLiteral nullLiteral);
}
