package com.psl.indexer.writer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class BatchResult {
    private final Map<String, ItemResult> items = new LinkedHashMap<>();

    public void add(ItemResult item) {
        items.put(item.paperIdV(), item);
    }

    public ItemResult get(String paperIdV) {
        return items.get(paperIdV);
    }

    public Collection<ItemResult> items() {
        return items.values();
    }

    public List<ItemResult> withOutcome(ItemOutcome outcome) {
        List<ItemResult> matches = new ArrayList<>();
        for (ItemResult item : items.values()) {
            if (item.outcome() == outcome) {
                matches.add(item);
            }
        }
        return matches;
    }

    public int size() {
        return items.size();
    }
}
