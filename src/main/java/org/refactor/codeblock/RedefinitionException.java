package org.refactor.codeblock;

public class RedefinitionException extends CodeBlockException {

    private final String variableName;

    public RedefinitionException(String variableName) {
        super(variableName + " is already defined");
        this.variableName = variableName;
    }

    public String getVariableName() {
        return variableName;
    }
}
