package org.refactor.codeblock.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 把代码按顶层 ';' 切成语句。字符串、字符字面量、注释和花括号内部的 ';' 不切分；
 * 以 def 开头的函数定义在匹配的 '}' 处结束。
 */
class StatementSplitter {

    static final Pattern DEF_START = Pattern.compile("^def\\b");

    /**
     * @param text   语句文本（不含结尾 ';'，已去掉前导空白）
     * @param offset text 在整段源码中的起始偏移
     */
    record Chunk(String text, int offset) {

        int endOffset() {
            return offset + text.length() - 1;
        }
    }

    private final String source;
    private final List<Diagnostic> diagnostics;
    private final SourcePositions positions;

    StatementSplitter(String source, SourcePositions positions, List<Diagnostic> diagnostics) {
        this.source = source;
        this.positions = positions;
        this.diagnostics = diagnostics;
    }

    /**
     * 切分 source 中 [from, to) 区间
     */
    List<Chunk> split(int from, int to) {
        List<Chunk> chunks = new ArrayList<>();
        int start = -1;
        int depth = 0;
        boolean def = false;
        int i = from;
        while (i < to) {
            char c = source.charAt(i);
            if (start < 0) {
                if (Character.isWhitespace(c) || c == ';') {
                    i++;
                    continue;
                }
                // 语句之间的注释不属于任何语句
                if (c == '/' && i + 1 < to && source.charAt(i + 1) == '/') {
                    i = skipLineComment(i, to);
                    continue;
                }
                if (c == '/' && i + 1 < to && source.charAt(i + 1) == '*') {
                    i = skipBlockComment(i, to);
                    continue;
                }
                start = i;
                def = DEF_START.matcher(source.substring(i, to)).find();
            }
            if (c == '"' || c == '\'') {
                i = skipLiteral(i, to, c);
                continue;
            }
            if (c == '/' && i + 1 < to && source.charAt(i + 1) == '/') {
                i = skipLineComment(i, to);
                continue;
            }
            if (c == '/' && i + 1 < to && source.charAt(i + 1) == '*') {
                i = skipBlockComment(i, to);
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                if (depth == 0) {
                    error("Unexpected '}'", i);
                    return chunks;
                }
                depth--;
                if (depth == 0 && def) {
                    add(chunks, start, i + 1);
                    start = -1;
                }
            } else if (c == ';' && depth == 0) {
                add(chunks, start, i);
                start = -1;
            }
            i++;
        }
        if (depth > 0) {
            error("Missing '}'", start);
        } else if (start >= 0) {
            add(chunks, start, to);
        }
        return chunks;
    }

    private void add(List<Chunk> chunks, int start, int end) {
        String text = source.substring(start, end).stripTrailing();
        if (!text.isEmpty()) {
            chunks.add(new Chunk(text, start));
        }
    }

    private int skipLiteral(int i, int to, char quote) {
        int j = i + 1;
        while (j < to) {
            char c = source.charAt(j);
            if (c == '\\') {
                j += 2;
                continue;
            }
            if (c == quote) {
                return j + 1;
            }
            if (c == '\n') {
                break;
            }
            j++;
        }
        error("Unterminated literal", i);
        return to;
    }

    private int skipLineComment(int i, int to) {
        int nl = source.indexOf('\n', i);
        return nl < 0 || nl >= to ? to : nl;
    }

    private int skipBlockComment(int i, int to) {
        int end = source.indexOf("*/", i + 2);
        if (end < 0 || end + 2 > to) {
            error("Unterminated comment", i);
            return to;
        }
        return end + 2;
    }

    private void error(String message, int offset) {
        diagnostics.add(new Diagnostic(message, positions.line(offset), positions.column(offset)));
    }
}
