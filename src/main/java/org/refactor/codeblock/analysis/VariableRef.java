package org.refactor.codeblock.analysis;

import org.refactor.codeblock.ast.Identifier;

import java.util.Objects;

/**
 * 变量在源码中的一次出现。不可变：列修正会产生新的实例。
 */
public final class VariableRef {

    public static final int NO_COLUMN = -1;

    private final String name;
    private final int row;
    private final int startColumn;

    public VariableRef(Identifier identifier) {
        this(Objects.requireNonNull(identifier).name(), identifier.line(), identifier.column());
    }

    /**
     * 只有行号的合成变量，不会作为端口暴露
     */
    public VariableRef(String name, int line) {
        this(name, line, NO_COLUMN);
    }

    private VariableRef(String name, int row, int startColumn) {
        this.name = Objects.requireNonNull(name);
        this.row = row;
        this.startColumn = startColumn;
    }

    public String getName() {
        return name;
    }

    public int getRow() {
        return row;
    }

    public int getStartColumn() {
        return startColumn;
    }

    public int getEndColumn() {
        return startColumn + name.length();
    }

    /**
     * 只移动与 line 同一行的变量
     */
    VariableRef movedBack(int line, int width) {
        if (row != line || startColumn == NO_COLUMN) {
            return this;
        }
        return new VariableRef(name, row, startColumn - width);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariableRef that)) return false;
        return row == that.row && startColumn == that.startColumn && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, row, startColumn);
    }

    @Override
    public String toString() {
        return name + "@" + row + ":" + startColumn;
    }
}
