package com.routewise.core.recommend;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "routewise.recommend")
public class RecommendProperties {

    /** Added to confidence when a provider's learned score beats the catalog median. */
    private double reliabilityBoost = 0.1;

    private int maxResults = 10;

    public double getReliabilityBoost() { return reliabilityBoost; }
    public void setReliabilityBoost(double reliabilityBoost) { this.reliabilityBoost = reliabilityBoost; }
    public int getMaxResults() { return maxResults; }
    public void setMaxResults(int maxResults) { this.maxResults = maxResults; }
}
