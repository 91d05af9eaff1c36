package org.refactor.codeblock;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

/**
 * 代码块需要持久化的全部状态：用户输入的原始文本 + 加载时是否获取焦点
 */
public record CodeBlockState(String code, boolean shouldFocus) {

    private static final Gson GSON = new Gson();

    public String toJson() {
        return GSON.toJson(this);
    }

    public static CodeBlockState fromJson(String json) {
        CodeBlockState state = GSON.fromJson(json, CodeBlockState.class);
        if (state == null) {
            throw new JsonParseException("Empty code block state");
        }
        return state.code() == null ? new CodeBlockState("", state.shouldFocus()) : state;
    }
}
