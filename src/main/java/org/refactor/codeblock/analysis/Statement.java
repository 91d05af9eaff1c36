package org.refactor.codeblock.analysis;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * 代码块中一条顶层语句（或函数体内语句）的分析结果。
 * 只有 FUNC_DECLARATION 会有子语句；其自身的定义/引用变量列表为空。
 */
public final class Statement {

    private final StatementKind kind;
    private final int startLine;
    private final int endLine;
    private final List<VariableRef> definedVariables;
    private final List<VariableRef> referencedVariables;
    private final List<Statement> subStatements;

    Statement(StatementKind kind, int startLine, int endLine, List<VariableRef> definedVariables,
              List<VariableRef> referencedVariables, List<Statement> subStatements) {
        this.kind = kind;
        this.startLine = startLine;
        this.endLine = endLine;
        this.definedVariables = List.copyOf(new LinkedHashSet<>(definedVariables));
        this.referencedVariables = List.copyOf(referencedVariables);
        this.subStatements = List.copyOf(subStatements);
    }

    public StatementKind getKind() {
        return kind;
    }

    public int getStartLine() {
        return startLine;
    }

    public int getEndLine() {
        return endLine;
    }

    public List<VariableRef> getDefinedVariables() {
        return definedVariables;
    }

    public List<VariableRef> getReferencedVariables() {
        return referencedVariables;
    }

    public List<Statement> getSubStatements() {
        return subStatements;
    }

    public VariableRef getFirstDefinedVariable() {
        return definedVariables.isEmpty() ? null : definedVariables.get(0);
    }

    public List<String> getDefinedVariableNames() {
        return definedVariables.stream().map(VariableRef::getName).toList();
    }

    /**
     * @param onlyTopLevel false 时递归包含子语句中定义的变量名
     */
    public List<String> getDefinedVariableNames(boolean onlyTopLevel) {
        List<String> names = new ArrayList<>(getDefinedVariableNames());
        if (!onlyTopLevel) {
            for (Statement sub : subStatements) {
                names.addAll(sub.getDefinedVariableNames(false));
            }
        }
        return names;
    }

    public List<String> getReferencedVariableNames(boolean onlyTopLevel) {
        List<String> names = new ArrayList<>(referencedVariables.stream().map(VariableRef::getName).toList());
        if (!onlyTopLevel) {
            for (Statement sub : subStatements) {
                names.addAll(sub.getReferencedVariableNames(false));
            }
        }
        return names;
    }

    @Override
    public String toString() {
        return kind + "[" + startLine + "-" + endLine + "] defs=" + definedVariables + " refs=" + referencedVariables;
    }
}
