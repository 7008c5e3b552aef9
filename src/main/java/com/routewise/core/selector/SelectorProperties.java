package com.routewise.core.selector;

import com.routewise.core.model.ComplexityClass;
import com.routewise.core.model.ProviderCategory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "routewise.selector")
public class SelectorProperties {

    /** Default primary category per complexity class. */
    private Map<ComplexityClass, ProviderCategory> primaryCategory = new EnumMap<>(Map.of(
            ComplexityClass.SIMPLE, ProviderCategory.GENERATION,
            ComplexityClass.MEDIUM, ProviderCategory.SEARCH,
            ComplexityClass.COMPLEX, ProviderCategory.REASONING));

    /** Cue phrases per category; two or more categories cued make a request hybrid. */
    private Map<ProviderCategory, List<String>> hybridCues = new EnumMap<>(Map.of(
            ProviderCategory.SEARCH, new ArrayList<>(List.of(
                    "search", "find", "look up", "lookup", "latest", "current", "news", "browse")),
            ProviderCategory.REASONING, new ArrayList<>(List.of(
                    "analyze", "analyse", "analysis", "compare", "evaluate", "assess", "explain why", "reason about")),
            ProviderCategory.EXECUTION, new ArrayList<>(List.of(
                    "code", "script", "compute", "calculate", "execute", "run the", "program")),
            ProviderCategory.GENERATION, new ArrayList<>(List.of(
                    "write", "draft", "generate", "summarize", "summarise", "compose"))));

    private int maxSecondaries = 2;

    /** Score assumed for a provider with no recorded history. */
    private double priorScore = 0.5;

    /** Success rate assumed for a primary with no recorded history, and the fixed prior term. */
    private double prior = 0.7;

    private double successWeight = 0.4;
    private double complexityWeight = 0.4;
    private double priorWeight = 0.2;

    /** Minimum confidence of a resolved plan for a simple request. */
    private double simpleConfidenceFloor = 0.6;

    public Map<ComplexityClass, ProviderCategory> getPrimaryCategory() { return primaryCategory; }
    public void setPrimaryCategory(Map<ComplexityClass, ProviderCategory> primaryCategory) { this.primaryCategory = primaryCategory; }
    public Map<ProviderCategory, List<String>> getHybridCues() { return hybridCues; }
    public void setHybridCues(Map<ProviderCategory, List<String>> hybridCues) { this.hybridCues = hybridCues; }
    public int getMaxSecondaries() { return maxSecondaries; }
    public void setMaxSecondaries(int maxSecondaries) { this.maxSecondaries = maxSecondaries; }
    public double getPriorScore() { return priorScore; }
    public void setPriorScore(double priorScore) { this.priorScore = priorScore; }
    public double getPrior() { return prior; }
    public void setPrior(double prior) { this.prior = prior; }
    public double getSuccessWeight() { return successWeight; }
    public void setSuccessWeight(double successWeight) { this.successWeight = successWeight; }
    public double getComplexityWeight() { return complexityWeight; }
    public void setComplexityWeight(double complexityWeight) { this.complexityWeight = complexityWeight; }
    public double getPriorWeight() { return priorWeight; }
    public void setPriorWeight(double priorWeight) { this.priorWeight = priorWeight; }
    public double getSimpleConfidenceFloor() { return simpleConfidenceFloor; }
    public void setSimpleConfidenceFloor(double simpleConfidenceFloor) { this.simpleConfidenceFloor = simpleConfidenceFloor; }
}
