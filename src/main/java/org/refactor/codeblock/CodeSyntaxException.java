package org.refactor.codeblock;

import org.refactor.codeblock.parser.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

public class CodeSyntaxException extends CodeBlockException {

    private final List<Diagnostic> diagnostics;

    public CodeSyntaxException(List<Diagnostic> diagnostics) {
        super(diagnostics.stream().map(Diagnostic::message).collect(Collectors.joining("\n")));
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
