package org.refactor.codeblock.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/**
 * 端口重建后恢复输出端口上的连线，分四个阶段：
 * <ol>
 *     <li>capture：旧端口销毁前，按 match key 保存远端端点</li>
 *     <li>exact：新端口的 match key 与保存的完全相同</li>
 *     <li>positional：同一个下标上的保存条目还没被使用</li>
 *     <li>leftover pool：剩下的条目按保存顺序依次分配给剩下的新端口，多出来的连线丢弃</li>
 * </ol>
 * 第 4 阶段是尽力而为：连线可能被接到名字和位置都不相关的端口上。
 * <p>
 * match key 就是端口的 tooltip；两个以上端口共用占位 tooltip 时，在后面追加各自的下标。
 */
public class ConnectorReconciler {

    @FunctionalInterface
    public interface Linker<E> {
        void link(int newPortIndex, E endpoint);
    }

    private final String placeholder;

    public ConnectorReconciler(String placeholder) {
        this.placeholder = placeholder;
    }

    public List<String> matchKeys(List<String> tooltips) {
        long placeholders = tooltips.stream().filter(placeholder::equals).count();
        List<String> keys = new ArrayList<>(tooltips.size());
        for (int i = 0; i < tooltips.size(); i++) {
            String tooltip = tooltips.get(i);
            keys.add(placeholders >= 2 && placeholder.equals(tooltip) ? tooltip + i : tooltip);
        }
        return keys;
    }

    public <E> ConnectionSnapshot<E> capture(List<String> oldTooltips, IntFunction<List<E>> endpointsOf) {
        ConnectionSnapshot<E> snapshot = new ConnectionSnapshot<>();
        List<String> keys = matchKeys(oldTooltips);
        for (int i = 0; i < keys.size(); i++) {
            List<E> endpoints = endpointsOf.apply(i);
            snapshot.add(keys.get(i), endpoints == null ? List.of() : endpoints);
        }
        return snapshot;
    }

    public <E> ReconcileReport restore(ConnectionSnapshot<E> snapshot, List<String> newTooltips, Linker<E> linker) {
        List<String> keys = matchKeys(newTooltips);
        boolean[] matched = new boolean[keys.size()];

        int exact = 0;
        for (int i = 0; i < keys.size(); i++) {
            ConnectionSnapshot.Entry<E> entry = snapshot.find(keys.get(i));
            if (entry != null && entry.isAvailable()) {
                relink(entry, i, linker);
                matched[i] = true;
                exact++;
            }
        }

        int positional = 0;
        for (int i = 0; i < keys.size(); i++) {
            if (matched[i]) continue;
            ConnectionSnapshot.Entry<E> entry = snapshot.at(i);
            if (entry != null && entry.isAvailable()) {
                relink(entry, i, linker);
                matched[i] = true;
                positional++;
            }
        }

        List<ConnectionSnapshot.Entry<E>> leftovers = new ArrayList<>();
        for (ConnectionSnapshot.Entry<E> entry : snapshot.getEntries()) {
            if (entry.isAvailable()) leftovers.add(entry);
        }
        List<Integer> unmatched = new ArrayList<>();
        for (int i = 0; i < matched.length; i++) {
            if (!matched[i]) unmatched.add(i);
        }

        int pooled = Math.min(leftovers.size(), unmatched.size());
        for (int k = 0; k < pooled; k++) {
            relink(leftovers.get(k), unmatched.get(k), linker);
        }

        int dropped = 0;
        for (int k = pooled; k < leftovers.size(); k++) {
            dropped += leftovers.get(k).getEndpoints().size();
        }
        return new ReconcileReport(exact, positional, pooled, dropped);
    }

    public <E> ReconcileReport reconcile(List<String> oldTooltips, List<String> newTooltips,
                                         IntFunction<List<E>> endpointsOf, Linker<E> linker) {
        return restore(capture(oldTooltips, endpointsOf), newTooltips, linker);
    }

    private static <E> void relink(ConnectionSnapshot.Entry<E> entry, int newIndex, Linker<E> linker) {
        for (E endpoint : entry.getEndpoints()) {
            linker.link(newIndex, endpoint);
        }
        entry.consume();
    }
}
