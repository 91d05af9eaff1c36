package org.refactor.codeblock.analysis;

/**
 * 端口描述。tooltipKey 是重连时使用的稳定标识，displayName 可能是截断或占位文本。
 *
 * @param verticalOffset 输出端口相对上一个端口的上边距，输入端口为 0
 * @param variableName   端口背后的真实变量名（占位端口对应合成临时变量）
 */
public record PortSpec(String displayName, String tooltipKey, double verticalOffset, String variableName) {

    public static PortSpec input(String displayName, String name) {
        return new PortSpec(displayName, name, 0, name);
    }

    public static PortSpec output(String displayName, String tooltipKey, double verticalOffset, String variableName) {
        return new PortSpec(displayName, tooltipKey, verticalOffset, variableName);
    }
}
