package org.refactor.codeblock;

public enum BlockState {
    ACTIVE,
    ERROR
}
