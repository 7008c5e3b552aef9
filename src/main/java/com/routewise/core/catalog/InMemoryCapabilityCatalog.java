package com.routewise.core.catalog;

import com.routewise.core.model.CapabilityProvider;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable catalog held in memory, ordered by provider id.
 */
public class InMemoryCapabilityCatalog implements CapabilityCatalog {

    private final List<CapabilityProvider> providers;
    private final Map<String, CapabilityProvider> byId;

    public InMemoryCapabilityCatalog(List<CapabilityProvider> providers) {
        var sorted = providers.stream()
                .sorted(Comparator.comparing(CapabilityProvider::id))
                .toList();
        var index = new LinkedHashMap<String, CapabilityProvider>();
        for (CapabilityProvider provider : sorted) {
            if (index.putIfAbsent(provider.id(), provider) != null) {
                throw new IllegalArgumentException("Duplicate provider id in catalog: " + provider.id());
            }
        }
        this.providers = sorted;
        this.byId = Map.copyOf(index);
    }

    @Override
    public List<CapabilityProvider> providers() {
        return providers;
    }

    @Override
    public Optional<CapabilityProvider> find(String providerId) {
        return Optional.ofNullable(providerId).map(byId::get);
    }
}
