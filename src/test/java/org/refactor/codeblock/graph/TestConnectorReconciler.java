package org.refactor.codeblock.graph;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TestConnectorReconciler {

    private static final String PLACEHOLDER = "Statement Output";

    private final ConnectorReconciler reconciler = new ConnectorReconciler(PLACEHOLDER);

    /**
     * 新端口下标 -> 重新连上的远端
     */
    private final Map<Integer, List<String>> links = new HashMap<>();

    private void link(int index, String endpoint) {
        links.computeIfAbsent(index, i -> new ArrayList<>()).add(endpoint);
    }

    private ReconcileReport run(List<String> oldTooltips, List<List<String>> oldWires, List<String> newTooltips) {
        return reconciler.reconcile(oldTooltips, newTooltips, oldWires::get, this::link);
    }

    private int linkedCount() {
        return links.values().stream().mapToInt(List::size).sum();
    }

    @Test
    public void testMatchKeys() {
        assertEquals(List.of("a", PLACEHOLDER, "b"), reconciler.matchKeys(List.of("a", PLACEHOLDER, "b")));
        assertEquals(List.of(PLACEHOLDER + "0", "a", PLACEHOLDER + "2"),
                reconciler.matchKeys(List.of(PLACEHOLDER, "a", PLACEHOLDER)));
    }

    @Test
    public void testExactMatch() {
        ReconcileReport report = run(List.of("a", "b"), List.of(List.of("n1"), List.of("n2", "n3")), List.of("b"));

        assertEquals(List.of("n2", "n3"), links.get(0));
        assertEquals(1, report.exactMatches());
        assertEquals(0, report.positionalMatches());
        assertEquals(0, report.pooledMatches());
        // 新端口只有一个，a 的连线没有去处
        assertEquals(1, report.droppedWires());
    }

    @Test
    public void testReorderIsResolvedByName() {
        ReconcileReport report = run(List.of("a", "b"), List.of(List.of("n1"), List.of("n2")), List.of("b", "a"));
        assertEquals(List.of("n2"), links.get(0));
        assertEquals(List.of("n1"), links.get(1));
        assertEquals(2, report.exactMatches());
    }

    @Test
    public void testPositionalFallback() {
        ReconcileReport report = run(List.of("a", "b"), List.of(List.of("n1"), List.of("n2")), List.of("c", "d"));
        assertEquals(List.of("n1"), links.get(0));
        assertEquals(List.of("n2"), links.get(1));
        assertEquals(0, report.exactMatches());
        assertEquals(2, report.positionalMatches());
        assertEquals(0, report.pooledMatches());
    }

    @Test
    public void testLeftoverPool() {
        // a 没有连线；x 在位置 0 上找不到可用条目，只能从剩余池里拿 c 的连线
        ReconcileReport report = run(List.of("a", "b", "c"), List.of(List.of(), List.of("n1"), List.of("n2")),
                List.of("x", "y"));

        assertEquals(List.of("n2"), links.get(0));
        assertEquals(List.of("n1"), links.get(1));
        assertEquals(1, report.positionalMatches());
        assertEquals(1, report.pooledMatches());
        assertEquals(0, report.droppedWires());
        assertEquals(2, linkedCount());
    }

    @Test
    public void testLeftoverPoolNotUsedWhenNamesResolve() {
        ReconcileReport report = run(List.of("a", "b", "c"), List.of(List.of("n1"), List.of("n2"), List.of("n3")),
                List.of("c", "b", "a"));
        assertEquals(3, report.exactMatches());
        assertEquals(0, report.pooledMatches());
    }

    @Test
    public void testLeftoversBeyondNewPortsAreDropped() {
        ReconcileReport report = run(List.of("a", "b", "c"), List.of(List.of("n1"), List.of("n2", "n3"), List.of("n4")),
                List.of("z"));
        assertEquals(List.of("n1"), links.get(0));
        assertEquals(3, report.droppedWires());
        assertEquals(4, linkedCount() + report.droppedWires());
    }

    @Test
    public void testNoWireIsDuplicated() {
        List<List<String>> wires = List.of(List.of("n1"), List.of("n2"), List.of("n3"), List.of("n4"));
        ReconcileReport report = run(List.of("a", "b", "c", "d"), wires, List.of("d", "x", "y", "z"));

        List<String> all = links.values().stream().flatMap(List::stream).toList();
        assertEquals(all.size(), all.stream().distinct().count());
        assertEquals(4, all.size() + report.droppedWires());
        assertEquals(List.of("n4"), links.get(0));
        assertEquals(1, report.exactMatches());
    }

    @Test
    public void testPlaceholderPorts() {
        // 两个占位端口按下标区分：新列表中第 1 个占位端口的 key 是 "Statement Output1"
        List<String> old = List.of(PLACEHOLDER, PLACEHOLDER);
        ReconcileReport report = run(old, List.of(List.of("n1"), List.of("n2")), List.of("v", PLACEHOLDER, PLACEHOLDER));

        assertEquals(1, report.exactMatches());
        assertEquals(List.of("n2"), links.get(1));
        assertEquals(List.of("n1"), links.get(0));
        assertNull(links.get(2));
    }

    @Test
    public void testSinglePlaceholderIsNotIndexed() {
        ReconcileReport report = run(List.of("a", PLACEHOLDER), List.of(List.of(), List.of("n1")),
                List.of(PLACEHOLDER));
        assertEquals(1, report.exactMatches());
        assertEquals(List.of("n1"), links.get(0));
    }

    @Test
    public void testSnapshot() {
        ConnectionSnapshot<String> snapshot = reconciler.capture(List.of("a", "b"),
                i -> i == 0 ? List.of("n1", "n2") : null);
        assertEquals(2, snapshot.size());
        assertEquals(2, snapshot.totalEndpoints());
        assertEquals("a", snapshot.at(0).getKey());
        assertTrue(snapshot.find("b").getEndpoints().isEmpty());
        assertNull(snapshot.at(2));
        assertFalse(snapshot.at(0).isConsumed());

        reconciler.restore(snapshot, List.of("a"), this::link);
        assertTrue(snapshot.find("a").isConsumed());
    }
}
