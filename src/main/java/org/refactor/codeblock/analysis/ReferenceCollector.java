package org.refactor.codeblock.analysis;

import org.refactor.codeblock.ast.*;

import java.util.List;

/**
 * 在赋值右侧按固定形状做 DFS，收集所有被引用的标识符。
 * 字面量不贡献任何变量。
 */
class ReferenceCollector implements AstVisitor<Void> {

    private final List<VariableRef> refs;

    ReferenceCollector(List<VariableRef> refs) {
        this.refs = refs;
    }

    void collect(AstNode node) {
        if (node != null) {
            node.accept(this);
        }
    }

    private void collectAll(List<AstNode> nodes) {
        nodes.forEach(this::collect);
    }

    @Override
    public Void visitAssignment(Assignment assignment) {
        // 嵌套赋值只看右侧，左值是定义而不是引用
        collect(assignment.value());
        return null;
    }

    @Override
    public Void visitFunctionDefinition(FunctionDefinition definition) {
        return null;
    }

    @Override
    public Void visitIdentifier(Identifier identifier) {
        refs.add(new VariableRef(identifier));
        collect(identifier.arrayIndex());
        return null;
    }

    @Override
    public Void visitFunctionCall(FunctionCall call) {
        collectAll(call.arguments());
        return null;
    }

    @Override
    public Void visitDotCall(DotCall dotCall) {
        collect(dotCall.call());
        return null;
    }

    @Override
    public Void visitArrayIndex(ArrayIndex arrayIndex) {
        collect(arrayIndex.base());
        collect(arrayIndex.index());
        return null;
    }

    @Override
    public Void visitCollection(CollectionLiteral collection) {
        collectAll(collection.elements());
        return null;
    }

    @Override
    public Void visitConditional(Conditional conditional) {
        collect(conditional.condition());
        collect(conditional.whenTrue());
        collect(conditional.whenFalse());
        return null;
    }

    @Override
    public Void visitRange(RangeExpr range) {
        collect(range.from());
        collect(range.to());
        collect(range.step());
        return null;
    }

    @Override
    public Void visitNumber(NumberLiteral number) {
        return null;
    }

    @Override
    public Void visitString(StringLiteral string) {
        return null;
    }

    @Override
    public Void visitBoolean(BooleanLiteral bool) {
        return null;
    }

    @Override
    public Void visitNull(NullLiteral nullLiteral) {
        return null;
    }
}
