package com.convoviewer.viewer.adapter;

import com.convoviewer.viewer.exception.SourceUnavailableException;
import com.convoviewer.viewer.model.Source;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Lookup of the configured adapter per source.
 */
@Slf4j
public class SourceAdapterRegistry {

    private final Map<Source, SourceAdapter> adapters = new EnumMap<>(Source.class);

    public SourceAdapterRegistry(Collection<? extends SourceAdapter> adapters) {
        for (SourceAdapter adapter : adapters) {
            if (this.adapters.putIfAbsent(adapter.source(), adapter) != null) {
                throw new IllegalArgumentException("Duplicate adapter for source " + adapter.source().id());
            }
            log.info("Registered {} adapter: root={}, enabled={}, available={}",
                    adapter.source().id(), adapter.rootPath(), adapter.isEnabled(), adapter.isAvailable());
        }
    }

    /**
     * @throws SourceUnavailableException if no adapter is configured for the source
     */
    public SourceAdapter get(Source source) {
        SourceAdapter adapter = adapters.get(source);
        if (adapter == null) {
            throw new SourceUnavailableException(source, "", "no adapter configured");
        }
        return adapter;
    }

    /** All adapters, in source declaration order. */
    public List<SourceAdapter> all() {
        return new ArrayList<>(adapters.values());
    }

    public List<SourceAdapter> enabled() {
        return adapters.values().stream()
                .filter(SourceAdapter::isEnabled)
                .collect(Collectors.toList());
    }
}
