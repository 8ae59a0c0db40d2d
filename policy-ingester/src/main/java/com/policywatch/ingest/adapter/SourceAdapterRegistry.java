package com.policywatch.ingest.adapter;

import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class SourceAdapterRegistry {

    private final Map<AdapterType, SourceAdapter> adapters = new EnumMap<>(AdapterType.class);

    public SourceAdapterRegistry(List<SourceAdapter> adapters) {
        adapters.forEach(a -> this.adapters.put(a.type(), a));
    }

    public SourceAdapter forType(AdapterType type) {
        SourceAdapter adapter = adapters.get(type);
        if (adapter == null) {
            throw new IllegalStateException("No adapter registered for " + type);
        }
        return adapter;
    }
}
