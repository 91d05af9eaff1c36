package org.refactor.codeblock;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * 端口布局等可调参数，从 classpath 上的 codeblock-config.json 读取（Gson）。
 * JSON 中缺失的字段保留这里的默认值。
 */
public class CodeBlockConfig {

    public static final String RESOURCE = "codeblock-config.json";

    public double lineHeight = 20;              // 每行代码对应的端口高度
    public double initialPortMargin = 4;        // 第一个输出端口的额外上边距
    public int maxInputLabelLength = 24;
    public int truncatedInputLabelLength = 21;
    public String ellipsis = "...";
    public String placeholderLabel = "Statement Output";
    public int maxNestingDepth = 64;            // 函数定义的最大嵌套层数

    public static CodeBlockConfig defaults() {
        return new CodeBlockConfig();
    }

    public static CodeBlockConfig load() {
        return load(CodeBlockConfig.class.getClassLoader(), RESOURCE);
    }

    public static CodeBlockConfig load(ClassLoader classLoader, String resource) {
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                return defaults();
            }
            return fromJson(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + resource, e);
        }
    }

    public static CodeBlockConfig fromJson(Reader reader) {
        CodeBlockConfig config = new Gson().fromJson(reader, CodeBlockConfig.class);
        if (config == null) {
            return defaults();
        }
        if (config.truncatedInputLabelLength > config.maxInputLabelLength) {
            throw new JsonParseException("truncatedInputLabelLength must not exceed maxInputLabelLength");
        }
        return config;
    }
}
