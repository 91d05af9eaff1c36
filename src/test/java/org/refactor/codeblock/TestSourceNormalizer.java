package org.refactor.codeblock;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class TestSourceNormalizer {

    @Test
    public void testEmpty() {
        assertEquals("", SourceNormalizer.normalize(""));
        assertEquals("", SourceNormalizer.normalize(null));
        assertEquals("", SourceNormalizer.normalize("  \r\n ; ;\t"));
    }

    @Test
    public void testTrailingSemicolon() {
        assertEquals("a = 1;", SourceNormalizer.normalize("a = 1"));
        assertEquals("a = 1;", SourceNormalizer.normalize("  a = 1;  "));
    }

    @Test
    public void testDropsEmptyStatements() {
        assertEquals("a = 1;b = 2;", SourceNormalizer.normalize("a = 1;;;b = 2"));
        assertEquals("a = 1;\nb = 2;", SourceNormalizer.normalize("a = 1;\n;\nb = 2;"));
    }

    @Test
    public void testCarriageReturns() {
        assertEquals("a = 1;\nb = 2;", SourceNormalizer.normalize("a = 1;\r\nb = 2;\r\n"));
    }

    @Test
    public void testIdempotent() {
        List<String> inputs = List.of("", "a", "a;", ";;a;;b", " x = 1 ;\n\n y = x;  ", "def f(a) { return a; }",
                "\r\n;\t;", "a = 1;\n ;\n b = 2\n");
        for (String input : inputs) {
            String once = SourceNormalizer.normalize(input);
            assertEquals(once, SourceNormalizer.normalize(once), input);
        }
    }
}
