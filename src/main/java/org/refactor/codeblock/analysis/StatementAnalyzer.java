package org.refactor.codeblock.analysis;

import org.refactor.codeblock.CodeBlockConfig;
import org.refactor.codeblock.StructuralException;
import org.refactor.codeblock.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * 将解析器给出的顶层 AST 节点转换为 {@link Statement}。
 * <p>
 * 顶层节点只能是赋值或函数定义，其它形状说明语法与分析器不一致，抛出 {@link StructuralException}。
 * 函数体按同样的规则递归分析，嵌套层数超过配置上限时同样视为结构错误。
 */
public class StatementAnalyzer {

    private final int maxNestingDepth;

    public StatementAnalyzer() {
        this(CodeBlockConfig.defaults());
    }

    public StatementAnalyzer(CodeBlockConfig config) {
        this.maxNestingDepth = config.maxNestingDepth;
    }

    public Statement analyze(AstNode astNode) {
        if (astNode == null) {
            throw new StructuralException("Cannot analyze a null statement");
        }
        return astNode.accept(new TopLevelVisitor(0));
    }

    public List<Statement> analyzeAll(List<AstNode> astNodes) {
        List<Statement> result = new ArrayList<>(astNodes.size());
        for (AstNode node : astNodes) {
            result.add(analyze(node));
        }
        return result;
    }

    /**
     * 按 rhs 形状分类，仅用于左值是合成临时变量的语句
     */
    static StatementKind classify(String firstDefined, AstNode rhs) {
        if (!SyntheticNames.isSynthetic(firstDefined)) {
            return StatementKind.EXPRESSION;
        }
        return rhs.accept(RHS_SHAPE);
    }

    private Statement analyzeAssignment(Assignment assignment) {
        // 1. 沿左侧链 a = b = rhs 收集定义变量
        List<VariableRef> defined = new ArrayList<>();
        AstNode current = assignment;
        while (current instanceof Assignment a) {
            defined.add(new VariableRef(a.target()));
            current = a.value();
        }
        AstNode rhs = current;

        // 2. 分类
        StatementKind kind = classify(defined.get(0).getName(), rhs);

        // 3. 只在 rhs 上收集引用变量
        List<VariableRef> referenced = new ArrayList<>();
        new ReferenceCollector(referenced).collect(rhs);

        // 4. 非 Expression 语句前面被插入了临时变量前缀，同一行上的列号要往回移
        if (kind != StatementKind.EXPRESSION) {
            referenced.replaceAll(ref -> ref.movedBack(assignment.line(), SyntheticNames.INSERTED_PREFIX_WIDTH));
        }
        return new Statement(kind, assignment.line(), assignment.endLine(), defined, referenced, List.of());
    }

    private static final AstVisitor<StatementKind> RHS_SHAPE = new AstVisitor<>() {
        @Override
        public StatementKind visitIdentifier(Identifier identifier) {
            return StatementKind.ASSIGNMENT_VAR;
        }

        @Override
        public StatementKind visitCollection(CollectionLiteral collection) {
            return StatementKind.COLLECTION;
        }

        @Override
        public StatementKind visitNumber(NumberLiteral number) {
            return StatementKind.LITERAL;
        }

        @Override
        public StatementKind visitString(StringLiteral string) {
            return StatementKind.LITERAL;
        }

        @Override
        public StatementKind visitAssignment(Assignment assignment) {
            return StatementKind.NONE;
        }

        @Override
        public StatementKind visitFunctionDefinition(FunctionDefinition definition) {
            return StatementKind.NONE;
        }

        @Override
        public StatementKind visitFunctionCall(FunctionCall call) {
            return StatementKind.NONE;
        }

        @Override
        public StatementKind visitDotCall(DotCall dotCall) {
            return StatementKind.NONE;
        }

        @Override
        public StatementKind visitArrayIndex(ArrayIndex arrayIndex) {
            return StatementKind.NONE;
        }

        @Override
        public StatementKind visitConditional(Conditional conditional) {
            return StatementKind.NONE;
        }

        @Override
        public StatementKind visitRange(RangeExpr range) {
            return StatementKind.NONE;
        }

        @Override
        public StatementKind visitBoolean(BooleanLiteral bool) {
            return StatementKind.NONE;
        }

        @Override
        public StatementKind visitNull(NullLiteral nullLiteral) {
            return StatementKind.NONE;
        }
    };

    private class TopLevelVisitor implements AstVisitor<Statement> {
        private final int depth;

        TopLevelVisitor(int depth) {
            this.depth = depth;
        }

        @Override
        public Statement visitAssignment(Assignment assignment) {
            return analyzeAssignment(assignment);
        }

        @Override
        public Statement visitFunctionDefinition(FunctionDefinition definition) {
            if (depth >= maxNestingDepth) {
                throw new StructuralException("Function definitions nested deeper than " + maxNestingDepth
                        + " levels in " + definition.name());
            }
            int endLine = definition.bodyEndLine() >= 0 ? definition.bodyEndLine() : definition.endLine();
            TopLevelVisitor inner = new TopLevelVisitor(depth + 1);
            List<Statement> subStatements = new ArrayList<>();
            for (AstNode node : definition.body()) {
                subStatements.add(node.accept(inner));
            }
            return new Statement(StatementKind.FUNC_DECLARATION, definition.line(), endLine,
                    List.of(), List.of(), subStatements);
        }

        private Statement reject(AstNode node) {
            throw new StructuralException("Must be func def or assignment: " + node.getClass().getSimpleName());
        }

        @Override
        public Statement visitIdentifier(Identifier identifier) {
            return reject(identifier);
        }

        @Override
        public Statement visitFunctionCall(FunctionCall call) {
            return reject(call);
        }

        @Override
        public Statement visitDotCall(DotCall dotCall) {
            return reject(dotCall);
        }

        @Override
        public Statement visitArrayIndex(ArrayIndex arrayIndex) {
            return reject(arrayIndex);
        }

        @Override
        public Statement visitCollection(CollectionLiteral collection) {
            return reject(collection);
        }

        @Override
        public Statement visitConditional(Conditional conditional) {
            return reject(conditional);
        }

        @Override
        public Statement visitRange(RangeExpr range) {
            return reject(range);
        }

        @Override
        public Statement visitNumber(NumberLiteral number) {
            return reject(number);
        }

        @Override
        public Statement visitString(StringLiteral string) {
            return reject(string);
        }

        @Override
        public Statement visitBoolean(BooleanLiteral bool) {
            return reject(bool);
        }

        @Override
        public Statement visitNull(NullLiteral nullLiteral) {
            return reject(nullLiteral);
        }
    }
}
