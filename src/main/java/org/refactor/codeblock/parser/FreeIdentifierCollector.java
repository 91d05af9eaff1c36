package org.refactor.codeblock.parser;

import org.refactor.codeblock.ast.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 收集未绑定标识符：被引用但没有在任何顶层语句中定义的名字，按第一次出现的顺序。
 * 函数体内的参数和局部定义只在该函数体内有效。
 */
class FreeIdentifierCollector implements AstVisitor<Void> {

    private final Set<String> bound;
    private final LinkedHashSet<String> free;

    private FreeIdentifierCollector(Set<String> bound, LinkedHashSet<String> free) {
        this.bound = bound;
        this.free = free;
    }

    static List<String> collect(List<AstNode> topLevel) {
        LinkedHashSet<String> free = new LinkedHashSet<>();
        FreeIdentifierCollector collector = new FreeIdentifierCollector(definedNames(topLevel), free);
        topLevel.forEach(collector::visit);
        return new ArrayList<>(free);
    }

    static Set<String> definedNames(List<AstNode> statements) {
        Set<String> names = new HashSet<>();
        for (AstNode node : statements) {
            if (node instanceof FunctionDefinition definition) {
                names.add(definition.name());
            }
            AstNode current = node;
            while (current instanceof Assignment assignment) {
                names.add(assignment.target().name());
                current = assignment.value();
            }
        }
        return names;
    }

    private void visit(AstNode node) {
        if (node != null) {
            node.accept(this);
        }
    }

    @Override
    public Void visitAssignment(Assignment assignment) {
        visit(assignment.value());
        return null;
    }

    @Override
    public Void visitFunctionDefinition(FunctionDefinition definition) {
        Set<String> inner = new HashSet<>(bound);
        inner.addAll(definition.parameters());
        inner.addAll(definedNames(definition.body()));
        FreeIdentifierCollector collector = new FreeIdentifierCollector(inner, free);
        definition.body().forEach(collector::visit);
        return null;
    }

    @Override
    public Void visitIdentifier(Identifier identifier) {
        if (!bound.contains(identifier.name())) {
            free.add(identifier.name());
        }
        visit(identifier.arrayIndex());
        return null;
    }

    @Override
    public Void visitFunctionCall(FunctionCall call) {
        call.arguments().forEach(this::visit);
        return null;
    }

    @Override
    public Void visitDotCall(DotCall dotCall) {
        visit(dotCall.call());
        return null;
    }

    @Override
    public Void visitArrayIndex(ArrayIndex arrayIndex) {
        visit(arrayIndex.base());
        visit(arrayIndex.index());
        return null;
    }

    @Override
    public Void visitCollection(CollectionLiteral collection) {
        collection.elements().forEach(this::visit);
        return null;
    }

    @Override
    public Void visitConditional(Conditional conditional) {
        visit(conditional.condition());
        visit(conditional.whenTrue());
        visit(conditional.whenFalse());
        return null;
    }

    @Override
    public Void visitRange(RangeExpr range) {
        visit(range.from());
        visit(range.to());
        visit(range.step());
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
