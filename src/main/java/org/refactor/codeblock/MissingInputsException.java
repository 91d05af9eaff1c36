package org.refactor.codeblock;

public class MissingInputsException extends IllegalArgumentException {

    public MissingInputsException(int expected, int actual) {
        super("Invalid input AST nodes: expected " + expected + ", got " + actual);
    }
}
