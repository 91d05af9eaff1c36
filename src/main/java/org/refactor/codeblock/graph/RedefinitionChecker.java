package org.refactor.codeblock.graph;

import java.util.List;
import java.util.Optional;

@FunctionalInterface
public interface RedefinitionChecker {

    /**
     * @return 第一个已经在同一个图的其它代码块中定义过的名字
     */
    Optional<String> findRedefinitionAcrossBlocks(String blockId, List<String> candidateNames);
}
