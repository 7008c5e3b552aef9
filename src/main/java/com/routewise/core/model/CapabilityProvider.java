package com.routewise.core.model;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * A backend that can attempt to satisfy a request: an LLM, a search agent,
 * a code-execution tool or a reasoning engine.
 * <p>
 * Keywords are normalised to lower case at construction so matching never
 * has to care about the catalog's spelling.
 */
public record CapabilityProvider(
    String id,
    String name,
    ProviderCategory category,
    Set<String> keywords,
    String description
) {

    public CapabilityProvider {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(category, "category");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Provider id must not be blank");
        }
        var normalised = new LinkedHashSet<String>();
        if (keywords != null) {
            for (String keyword : keywords) {
                if (keyword != null && !keyword.isBlank()) {
                    normalised.add(keyword.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        keywords = Set.copyOf(normalised);
        name = name == null || name.isBlank() ? id : name;
        description = description == null ? "" : description;
    }
}
