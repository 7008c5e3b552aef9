package com.routewise.core.catalog;

import com.routewise.core.model.CapabilityProvider;
import com.routewise.core.model.ProviderCategory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Provider entries bound from {@code routewise.catalog.providers[*]}.
 */
@Component
@ConfigurationProperties(prefix = "routewise.catalog")
public class CatalogProperties {

    private List<ProviderEntry> providers = new ArrayList<>();

    public List<ProviderEntry> getProviders() {
        return providers;
    }

    public void setProviders(List<ProviderEntry> providers) {
        this.providers = providers;
    }

    public List<CapabilityProvider> toProviders() {
        return providers.stream().map(ProviderEntry::toProvider).toList();
    }

    public static class ProviderEntry {
        private String id;
        private String name;
        private ProviderCategory category;
        private List<String> keywords = new ArrayList<>();
        private String description = "";

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public ProviderCategory getCategory() { return category; }
        public void setCategory(ProviderCategory category) { this.category = category; }
        public List<String> getKeywords() { return keywords; }
        public void setKeywords(List<String> keywords) { this.keywords = keywords; }
        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }

        CapabilityProvider toProvider() {
            if (category == null) {
                throw new IllegalStateException("Catalog entry '" + id + "' has no category");
            }
            return new CapabilityProvider(id, name, category, new LinkedHashSet<>(keywords), description);
        }
    }
}
