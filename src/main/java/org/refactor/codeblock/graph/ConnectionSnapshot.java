package org.refactor.codeblock.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 重建端口之前保存的连线：match key -> 远端端点（按旧端口顺序）
 */
public class ConnectionSnapshot<E> {

    public static final class Entry<E> {
        private final int index;
        private final String key;
        private final List<E> endpoints;
        private boolean consumed;

        Entry(int index, String key, List<E> endpoints) {
            this.index = index;
            this.key = key;
            this.endpoints = List.copyOf(endpoints);
        }

        public int getIndex() {
            return index;
        }

        public String getKey() {
            return key;
        }

        public List<E> getEndpoints() {
            return endpoints;
        }

        public boolean isConsumed() {
            return consumed;
        }

        /**
         * 没有连线的条目不参与匹配
         */
        boolean isAvailable() {
            return !consumed && !endpoints.isEmpty();
        }

        void consume() {
            consumed = true;
        }
    }

    private final List<Entry<E>> entries = new ArrayList<>();
    private final Map<String, Entry<E>> byKey = new LinkedHashMap<>();

    void add(String key, List<E> endpoints) {
        Entry<E> entry = new Entry<>(entries.size(), key, endpoints);
        entries.add(entry);
        byKey.putIfAbsent(key, entry);
    }

    public List<Entry<E>> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public Entry<E> find(String key) {
        return byKey.get(key);
    }

    public Entry<E> at(int index) {
        return index >= 0 && index < entries.size() ? entries.get(index) : null;
    }

    public int size() {
        return entries.size();
    }

    public int totalEndpoints() {
        return entries.stream().mapToInt(e -> e.endpoints.size()).sum();
    }
}
