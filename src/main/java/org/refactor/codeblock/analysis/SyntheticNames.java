package org.refactor.codeblock.analysis;

import java.util.UUID;

/**
 * 解析器为非赋值语句自动生成的临时变量名：{@code temp} + 8 位十六进制。
 * 插入到语句前面的文本是 {@code tempXXXXXXXX=}，正好 {@link #INSERTED_PREFIX_WIDTH} 个字符。
 */
public final class SyntheticNames {

    public static final String PREFIX = "temp";
    public static final int LENGTH_THRESHOLD = 10;
    public static final int SUFFIX_LENGTH = 8;
    public static final int INSERTED_PREFIX_WIDTH = PREFIX.length() + SUFFIX_LENGTH + 1;

    private SyntheticNames() {
    }

    public static boolean isSynthetic(String name) {
        return name != null && name.startsWith(PREFIX) && name.length() > LENGTH_THRESHOLD;
    }

    public static String randomName() {
        return PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, SUFFIX_LENGTH);
    }

    public static String assignmentPrefix(String name) {
        return name + "=";
    }
}
