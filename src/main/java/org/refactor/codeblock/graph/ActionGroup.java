package org.refactor.codeblock.graph;

/**
 * 一次撤销分组；用 try-with-resources 保证任何退出路径都会关闭。
 */
public interface ActionGroup extends AutoCloseable {

    @Override
    void close();
}
