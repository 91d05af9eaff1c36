package org.refactor.codeblock.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 字符偏移 -> (行, 列)，行列都从 1 开始
 */
class SourcePositions {

    private final List<Integer> lineStarts = new ArrayList<>();

    SourcePositions(String text) {
        lineStarts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lineStarts.add(i + 1);
            }
        }
    }

    int line(int offset) {
        int idx = Collections.binarySearch(lineStarts, offset);
        return idx >= 0 ? idx + 1 : -idx - 1;
    }

    int column(int offset) {
        return offset - lineStarts.get(line(offset) - 1) + 1;
    }
}
