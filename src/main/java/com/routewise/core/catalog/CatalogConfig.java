package com.routewise.core.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CatalogConfig {

    private static final Logger log = LoggerFactory.getLogger(CatalogConfig.class);

    /**
     * Catalog built from configuration. Applications that discover providers
     * some other way can declare their own {@link CapabilityCatalog} bean.
     */
    @Bean
    @ConditionalOnMissingBean(CapabilityCatalog.class)
    public CapabilityCatalog capabilityCatalog(CatalogProperties properties) {
        var catalog = new InMemoryCapabilityCatalog(properties.toProviders());
        if (catalog.isEmpty()) {
            log.warn("Capability catalog is empty; every plan will be unresolved");
        } else {
            log.info("Loaded {} capability providers", catalog.providers().size());
        }
        return catalog;
    }
}
