package com.routewise.core.selector;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunable rules for complexity classification. The defaults are heuristics,
 * not measured values.
 */
@Component
@ConfigurationProperties(prefix = "routewise.classifier")
public class ClassifierProperties {

    /** Requests at least this long (characters) get a medium length vote. */
    private int mediumLength = 80;

    /** Requests at least this long get a complex length vote. */
    private int complexLength = 240;

    private List<String> multiStepCues = new ArrayList<>(List.of(
            "then", "and also", "after that", "afterwards", "followed by",
            "step by step", "finally", "subsequently", "once that is done"));

    private List<String> freshnessCues = new ArrayList<>(List.of(
            "latest", "current", "currently", "today", "tonight", "yesterday", "recent", "recently",
            "this week", "this month", "this year", "right now", "breaking", "up to date", "as of"));

    /** Treat explicit years and the month names below as freshness cues. */
    private boolean dateReferencesEnabled = true;

    /**
     * Month names counted as date references. "may" is left out: as a modal
     * verb ("May I ...") it would mark ordinary requests as time-sensitive.
     */
    private List<String> monthNames = new ArrayList<>(List.of(
            "january", "february", "march", "april", "june", "july",
            "august", "september", "october", "november", "december"));

    public int getMediumLength() { return mediumLength; }
    public void setMediumLength(int mediumLength) { this.mediumLength = mediumLength; }
    public int getComplexLength() { return complexLength; }
    public void setComplexLength(int complexLength) { this.complexLength = complexLength; }
    public List<String> getMultiStepCues() { return multiStepCues; }
    public void setMultiStepCues(List<String> multiStepCues) { this.multiStepCues = multiStepCues; }
    public List<String> getFreshnessCues() { return freshnessCues; }
    public void setFreshnessCues(List<String> freshnessCues) { this.freshnessCues = freshnessCues; }
    public boolean isDateReferencesEnabled() { return dateReferencesEnabled; }
    public void setDateReferencesEnabled(boolean dateReferencesEnabled) { this.dateReferencesEnabled = dateReferencesEnabled; }
    public List<String> getMonthNames() { return monthNames; }
    public void setMonthNames(List<String> monthNames) { this.monthNames = monthNames; }
}
