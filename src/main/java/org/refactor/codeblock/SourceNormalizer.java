package org.refactor.codeblock;

/**
 * 规范化用户输入：
 * 1. 去掉 '\r' 以及首尾空白
 * 2. 删除只含空白的语句片段（多余的分号）
 * 3. 保证以唯一一个 ';' 结尾（空文本保持为空）
 */
public final class SourceNormalizer {

    private SourceNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String code = text.replace("\r", "").trim();

        StringBuilder sb = new StringBuilder();
        // limit -1：保留末尾的空片段，后面统一按空白过滤
        for (String fragment : code.split(";", -1)) {
            if (!fragment.isBlank()) {
                sb.append(fragment).append(';');
            }
        }
        return sb.toString();
    }
}
