package org.refactor.codeblock.graph;

/**
 * 连线的远端：另一个节点的输入端口
 */
public record PortRef(String nodeId, int inputIndex) {
}
