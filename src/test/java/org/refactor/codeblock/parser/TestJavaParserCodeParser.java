package org.refactor.codeblock.parser;

import org.junit.jupiter.api.Test;
import org.refactor.codeblock.ast.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestJavaParserCodeParser {

    private int counter;
    private final JavaParserCodeParser parser = new JavaParserCodeParser(() -> String.format("temp%08x", counter++));

    private ParsedBlock parseOk(String code) {
        ParsedBlock parsed = parser.parse(code);
        assertTrue(parsed.isSuccessful(), () -> "Unexpected diagnostics " + parsed.diagnostics());
        return parsed;
    }

    @Test
    public void testAssignment() {
        ParsedBlock parsed = parseOk("y = x + 1;");
        assertEquals(List.of("x"), parsed.freeIdentifiers());
        assertEquals("y = x + 1;", parsed.source());

        Assignment assignment = (Assignment) parsed.nodes().get(0);
        assertEquals("y", assignment.target().name());
        FunctionCall plus = (FunctionCall) assignment.value();
        assertEquals("%plus", plus.name());
        Identifier x = (Identifier) plus.arguments().get(0);
        assertEquals(1, x.line());
        assertEquals(5, x.column());
    }

    @Test
    public void testSyntheticTemporary() {
        ParsedBlock parsed = parseOk("5;\nx;");
        assertEquals("temp00000000=5;\ntemp00000001=x;", parsed.source());
        assertEquals(List.of("x"), parsed.freeIdentifiers());

        Assignment first = (Assignment) parsed.nodes().get(0);
        assertEquals("temp00000000", first.target().name());
        assertEquals(5, ((NumberLiteral) first.value()).value().intValue());

        // x 在原文第 2 行第 1 列，插入的前缀把它推到第 14 列
        Identifier x = (Identifier) ((Assignment) parsed.nodes().get(1)).value();
        assertEquals(2, x.line());
        assertEquals(14, x.column());
    }

    @Test
    public void testReparseOfRewrittenSourceKeepsNames() {
        ParsedBlock parsed = parseOk("1 + 2;");
        ParsedBlock again = parseOk(parsed.source());
        assertEquals(parsed.source(), again.source());
        assertEquals(((Assignment) parsed.nodes().get(0)).target().name(),
                ((Assignment) again.nodes().get(0)).target().name());
    }

    @Test
    public void testChainedAssignment() {
        Assignment a = (Assignment) parseOk("a = b = 3;").nodes().get(0);
        assertEquals("a", a.target().name());
        Assignment b = (Assignment) a.value();
        assertEquals("b", b.target().name());
        assertInstanceOf(NumberLiteral.class, b.value());
    }

    @Test
    public void testPositionsOverSeveralLines() {
        ParsedBlock parsed = parseOk("a = 1;\nb = f(a,\n   c);");
        Assignment b = (Assignment) parsed.nodes().get(1);
        assertEquals(2, b.line());
        assertEquals(3, b.endLine());
        FunctionCall call = (FunctionCall) b.value();
        Identifier a = (Identifier) call.arguments().get(0);
        Identifier c = (Identifier) call.arguments().get(1);
        assertEquals(2, a.line());
        assertEquals(7, a.column());
        assertEquals(3, c.line());
        assertEquals(4, c.column());
        assertEquals(List.of("c"), parsed.freeIdentifiers());
    }

    @Test
    public void testExpressionShapes() {
        Assignment v = (Assignment) parseOk("v = c ? new int[]{1, x} : a.foo(b[i]);").nodes().get(0);
        Conditional conditional = (Conditional) v.value();
        CollectionLiteral list = (CollectionLiteral) conditional.whenTrue();
        assertEquals(2, list.elements().size());
        DotCall dot = (DotCall) conditional.whenFalse();
        assertEquals("foo", dot.call().name());
        assertEquals("a", ((Identifier) dot.call().arguments().get(0)).name());
        Identifier b = (Identifier) dot.call().arguments().get(1);
        assertEquals("i", ((Identifier) b.arrayIndex()).name());
    }

    @Test
    public void testLiterals() {
        List<AstNode> nodes = parseOk("s = \"a;b\"; t = true; n = null; d = 2.5; m = -k;").nodes();
        assertEquals(5, nodes.size());
        assertEquals("a;b", ((StringLiteral) ((Assignment) nodes.get(0)).value()).value());
        assertTrue(((BooleanLiteral) ((Assignment) nodes.get(1)).value()).value());
        assertInstanceOf(NullLiteral.class, ((Assignment) nodes.get(2)).value());
        assertEquals(2.5, ((NumberLiteral) ((Assignment) nodes.get(3)).value()).value().doubleValue());
        assertEquals("%minus", ((FunctionCall) ((Assignment) nodes.get(4)).value()).name());
    }

    @Test
    public void testFunctionDefinition() {
        ParsedBlock parsed = parseOk("def f(x) {\n  return x + 1;\n}\ny = f(2);");
        assertEquals(2, parsed.nodes().size());
        assertTrue(parsed.freeIdentifiers().isEmpty());

        FunctionDefinition f = (FunctionDefinition) parsed.nodes().get(0);
        assertEquals("f", f.name());
        assertEquals(List.of("x"), f.parameters());
        assertEquals(1, f.line());
        assertEquals(3, f.bodyEndLine());

        Assignment ret = (Assignment) f.body().get(0);
        assertEquals("return", ret.target().name());
        assertEquals(2, ret.target().line());
        assertEquals(3, ret.target().column());
        Identifier x = (Identifier) ((FunctionCall) ret.value()).arguments().get(0);
        assertEquals(10, x.column());
    }

    @Test
    public void testReturnAssignmentStyle() {
        FunctionDefinition g = (FunctionDefinition) parseOk("def g() { return = 3; }").nodes().get(0);
        assertTrue(g.parameters().isEmpty());
        Assignment ret = (Assignment) g.body().get(0);
        assertEquals("return", ret.target().name());
        assertInstanceOf(NumberLiteral.class, ret.value());
    }

    @Test
    public void testFreeIdentifiers() {
        assertEquals(List.of("d"), parseOk("b = a; a = 1; c = d + d;").freeIdentifiers());
        assertEquals(List.of("r", "t"), parseOk("def f(p) { q = p + r; return q; } s = f(t);").freeIdentifiers());
    }

    @Test
    public void testSyntaxError() {
        ParsedBlock parsed = parser.parse("a = 1;\nb = ;");
        assertFalse(parsed.isSuccessful());
        assertTrue(parsed.nodes().isEmpty());
        int line = parsed.diagnostics().get(0).line();
        assertTrue(line == 2 || line == -1, "line " + line);
        assertFalse(parsed.diagnostics().get(0).message().isBlank());
    }

    @Test
    public void testUnsupportedAssignment() {
        ParsedBlock parsed = parser.parse("a += 1;");
        assertFalse(parsed.isSuccessful());
        assertTrue(parsed.diagnostics().get(0).message().contains("name = value"));
    }

    @Test
    public void testUnbalancedBraces() {
        assertFalse(parser.parse("def f() { return 1;").isSuccessful());
        assertFalse(parser.parse("a = 1; }").isSuccessful());
        assertFalse(parser.parse("def f(1x) { return 1; }").isSuccessful());
    }

    @Test
    public void testComments() {
        assertEquals(1, parseOk("a = 1; // note;").nodes().size());
        assertEquals(1, parseOk("a = 1; /* c */;").nodes().size());

        ParsedBlock parsed = parseOk("// header\n5;");
        assertEquals("// header\ntemp00000000=5;", parsed.source());
        assertEquals(2, ((Assignment) parsed.nodes().get(0)).line());

        FunctionDefinition f = (FunctionDefinition) parseOk("def f() {\n  // body\n  return 1;\n}").nodes().get(0);
        assertEquals(1, f.body().size());
    }

    @Test
    public void testNumberOutOfRange() {
        ParsedBlock parsed = parser.parse("a = 99999999999;");
        assertFalse(parsed.isSuccessful());
        assertTrue(parsed.diagnostics().get(0).message().startsWith("Number out of range"));
        assertEquals(5, parsed.diagnostics().get(0).column());

        assertFalse(parser.parse("b = 99999999999999999999L;").isSuccessful());
    }

    @Test
    public void testClassQualifiedCall() {
        ParsedBlock parsed = parseOk("y = Math.sin(x) + Math.PI;");
        assertEquals(List.of("x"), parsed.freeIdentifiers());
        FunctionCall plus = (FunctionCall) ((Assignment) parsed.nodes().get(0)).value();
        FunctionCall sin = (FunctionCall) plus.arguments().get(0);
        assertEquals("Math.sin", sin.name());
        assertEquals(1, sin.arguments().size());
        assertEquals("Math.PI", ((FunctionCall) plus.arguments().get(1)).name());
    }

    @Test
    public void testEmpty() {
        ParsedBlock parsed = parseOk("");
        assertTrue(parsed.nodes().isEmpty());
        assertEquals("", parsed.source());
    }
}
