package com.panwatch.agent;

import com.panwatch.datasource.DataItem;
import com.panwatch.domain.enums.DataSourceType;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Data fetched for one run, by type. Items carry their own symbol. */
public class CollectedData {

    private final Map<DataSourceType, List<DataItem>> itemsByType = new EnumMap<>(DataSourceType.class);

    public void add(DataSourceType type, List<DataItem> items) {
        itemsByType.computeIfAbsent(type, t -> new ArrayList<>()).addAll(items);
    }

    public List<DataItem> get(DataSourceType type) {
        return itemsByType.getOrDefault(type, List.of());
    }

    public List<DataItem> forSymbol(DataSourceType type, String symbol) {
        return get(type).stream()
                .filter(item -> item.getSymbol() == null || item.getSymbol().equalsIgnoreCase(symbol))
                .toList();
    }

    public Set<DataSourceType> types() {
        return itemsByType.keySet();
    }

    public int totalItems() {
        return itemsByType.values().stream().mapToInt(List::size).sum();
    }
}
