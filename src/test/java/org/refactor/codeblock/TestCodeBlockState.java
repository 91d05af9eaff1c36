package org.refactor.codeblock;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TestCodeBlockState {

    @Test
    public void testJson() {
        CodeBlockState state = new CodeBlockState("a = 1;\r\nb = a;", false);
        String json = state.toJson();
        assertTrue(json.contains("\"shouldFocus\":false"), json);
        assertEquals(state, CodeBlockState.fromJson(json));
    }

    @Test
    public void testMissingCode() {
        CodeBlockState state = CodeBlockState.fromJson("{\"shouldFocus\":true}");
        assertEquals("", state.code());
        assertTrue(state.shouldFocus());
    }
}
