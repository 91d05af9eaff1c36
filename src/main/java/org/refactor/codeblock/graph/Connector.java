package org.refactor.codeblock.graph;

/**
 * 从代码块的某个输出端口连到远端输入端口的一条连线
 */
public record Connector(String blockId, int outputIndex, PortRef end) {
}
