package org.refactor.codeblock.graph;

import java.util.List;

/**
 * 图中属于某个代码块输出端口的连线。连线归图所有，这里只读取和重新连接。
 */
public interface ConnectorStore {

    List<PortRef> connectionsOf(int outputIndex);

    void disconnect(int outputIndex);

    void connect(int outputIndex, PortRef end);
}
