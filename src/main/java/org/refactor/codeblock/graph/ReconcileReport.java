package org.refactor.codeblock.graph;

/**
 * 各阶段恢复的端口数，以及最终丢弃的连线数
 */
public record ReconcileReport(int exactMatches, int positionalMatches, int pooledMatches, int droppedWires) {

    public int restoredPorts() {
        return exactMatches + positionalMatches + pooledMatches;
    }
}
