package org.refactor.codeblock.parser;

import com.github.javaparser.Position;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.*;
import org.refactor.codeblock.ast.ArrayIndex;
import org.refactor.codeblock.ast.AstNode;
import org.refactor.codeblock.ast.Assignment;
import org.refactor.codeblock.ast.BooleanLiteral;
import org.refactor.codeblock.ast.CollectionLiteral;
import org.refactor.codeblock.ast.Conditional;
import org.refactor.codeblock.ast.DotCall;
import org.refactor.codeblock.ast.FunctionCall;
import org.refactor.codeblock.ast.Identifier;
import org.refactor.codeblock.ast.NullLiteral;
import org.refactor.codeblock.ast.NumberLiteral;
import org.refactor.codeblock.ast.StringLiteral;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * JavaParser 表达式 -> 代码块 AST。
 * <p>
 * JavaParser 给出的位置是相对于单条语句文本的，这里换算回整段代码中的行列；
 * 语句第一行上的列号额外加上 firstLineShift（被插入的合成临时变量前缀宽度）。
 */
class ExpressionConverter {

    private final int baseLine;
    private final int baseColumn;
    private final int firstLineShift;
    private final List<Diagnostic> diagnostics;

    ExpressionConverter(int baseLine, int baseColumn, int firstLineShift, List<Diagnostic> diagnostics) {
        this.baseLine = baseLine;
        this.baseColumn = baseColumn;
        this.firstLineShift = firstLineShift;
        this.diagnostics = diagnostics;
    }

    int line(Position p) {
        return baseLine + p.line - 1;
    }

    int column(Position p) {
        return p.line == 1 ? baseColumn + p.column - 1 + firstLineShift : p.column;
    }

    int beginLine(Node node) {
        return node.getBegin().map(this::line).orElse(baseLine);
    }

    int endLine(Node node) {
        return node.getEnd().map(this::line).orElse(baseLine);
    }

    Identifier identifier(String name, Node node, AstNode arrayIndex) {
        Position p = node.getBegin().orElse(new Position(1, 1));
        return new Identifier(name, line(p), column(p), arrayIndex);
    }

    AstNode convert(Expression e) {
        if (e instanceof EnclosedExpr enclosed) {
            return convert(enclosed.getInner());
        }
        if (e instanceof AssignExpr assign) {
            if (assign.getOperator() != AssignExpr.Operator.ASSIGN || !assign.getTarget().isNameExpr()) {
                return unsupported(e, "Only assignments of the form name = value are supported");
            }
            Identifier target = identifier(assign.getTarget().asNameExpr().getNameAsString(), assign.getTarget(), null);
            return new Assignment(target, convert(assign.getValue()), beginLine(assign), endLine(assign));
        }
        if (e instanceof NameExpr name) {
            return identifier(name.getNameAsString(), name, null);
        }
        if (e instanceof ArrayAccessExpr access) {
            // a[i] 是带下标的标识符，a[i][j] 之类的才是独立的下标节点
            if (access.getName() instanceof NameExpr base) {
                return identifier(base.getNameAsString(), base, convert(access.getIndex()));
            }
            return new ArrayIndex(convert(access.getName()), convert(access.getIndex()));
        }
        if (e instanceof MethodCallExpr call) {
            List<AstNode> args = new ArrayList<>();
            Expression scope = call.getScope().orElse(null);
            // Math.sin(x)：类名限定的调用是普通函数调用，类名不是变量
            if (scope != null && isTypeName(scope)) {
                call.getArguments().forEach(arg -> args.add(convert(arg)));
                return new FunctionCall(qualified(scope, call.getNameAsString()), args);
            }
            if (scope != null) {
                args.add(convert(scope));
            }
            call.getArguments().forEach(arg -> args.add(convert(arg)));
            FunctionCall functionCall = new FunctionCall(call.getNameAsString(), args);
            return scope != null ? new DotCall(functionCall) : functionCall;
        }
        if (e instanceof FieldAccessExpr field) {
            if (isTypeName(field.getScope())) {
                return new FunctionCall(qualified(field.getScope(), field.getNameAsString()), List.of());
            }
            return new DotCall(new FunctionCall(field.getNameAsString(), List.of(convert(field.getScope()))));
        }
        if (e instanceof BinaryExpr binary) {
            return new FunctionCall(operatorName(binary.getOperator().name()),
                    List.of(convert(binary.getLeft()), convert(binary.getRight())));
        }
        if (e instanceof UnaryExpr unary) {
            return new FunctionCall(operatorName(unary.getOperator().name()), List.of(convert(unary.getExpression())));
        }
        if (e instanceof ConditionalExpr conditional) {
            return new Conditional(convert(conditional.getCondition()), convert(conditional.getThenExpr()),
                    convert(conditional.getElseExpr()));
        }
        if (e instanceof ArrayCreationExpr creation) {
            if (creation.getInitializer().isEmpty()) {
                return unsupported(e, "Array creation needs an initializer");
            }
            return convert(creation.getInitializer().get());
        }
        if (e instanceof ArrayInitializerExpr initializer) {
            List<AstNode> elements = new ArrayList<>();
            initializer.getValues().forEach(v -> elements.add(convert(v)));
            return new CollectionLiteral(elements);
        }
        if (e instanceof IntegerLiteralExpr integer) {
            try {
                return new NumberLiteral(integer.asNumber());
            } catch (NumberFormatException nfe) {
                return unsupported(e, "Number out of range: " + integer.getValue());
            }
        }
        if (e instanceof LongLiteralExpr longLiteral) {
            try {
                return new NumberLiteral(longLiteral.asNumber());
            } catch (NumberFormatException nfe) {
                return unsupported(e, "Number out of range: " + longLiteral.getValue());
            }
        }
        if (e instanceof DoubleLiteralExpr doubleLiteral) {
            return new NumberLiteral(doubleLiteral.asDouble());
        }
        if (e instanceof StringLiteralExpr string) {
            return new StringLiteral(string.asString());
        }
        if (e instanceof CharLiteralExpr character) {
            return new StringLiteral(String.valueOf(character.asChar()));
        }
        if (e instanceof BooleanLiteralExpr bool) {
            return new BooleanLiteral(bool.getValue());
        }
        if (e instanceof NullLiteralExpr) {
            return new NullLiteral();
        }
        return unsupported(e, "Unsupported expression: " + e);
    }

    private static boolean isTypeName(Expression scope) {
        return scope instanceof NameExpr name && Character.isUpperCase(name.getNameAsString().charAt(0));
    }

    private static String qualified(Expression typeName, String member) {
        return typeName.asNameExpr().getNameAsString() + "." + member;
    }

    private static String operatorName(String javaName) {
        return "%" + javaName.toLowerCase(Locale.ROOT);
    }

    private AstNode unsupported(Expression e, String message) {
        Position p = e.getBegin().orElse(new Position(1, 1));
        diagnostics.add(new Diagnostic(message, line(p), column(p)));
        return new NullLiteral();
    }
}
