package com.routewise.core.catalog;

import com.routewise.core.model.CapabilityProvider;
import com.routewise.core.model.ProviderCategory;

import java.util.List;
import java.util.Optional;

/**
 * Read-only lookup of known capability providers. How providers get here
 * (configuration, registry, discovery) is up to the implementation.
 */
public interface CapabilityCatalog {

    /** All providers in stable id order. */
    List<CapabilityProvider> providers();

    Optional<CapabilityProvider> find(String providerId);

    default List<CapabilityProvider> byCategory(ProviderCategory category) {
        return providers().stream()
                .filter(p -> p.category() == category)
                .toList();
    }

    default boolean isEmpty() {
        return providers().isEmpty();
    }
}
