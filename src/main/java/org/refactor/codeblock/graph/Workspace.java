package org.refactor.codeblock.graph;

/**
 * 代码块所在的图：端口、连线、撤销记录以及跨代码块的重复定义查询。
 */
public interface Workspace extends RedefinitionChecker {

    PortRegistry portsOf(String blockId);

    ConnectorStore connectorsOf(String blockId);

    UndoRecorder undoRecorder();
}
