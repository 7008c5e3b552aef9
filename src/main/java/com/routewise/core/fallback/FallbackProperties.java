package com.routewise.core.fallback;

import com.routewise.core.model.EscalationLevel;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "routewise.fallback")
public class FallbackProperties {

    /** A successful record scoring below this still counts as a failure. */
    private double acceptableScore = 0.5;

    /** How many of a chain's latest records the escalator looks at. */
    private int historyWindow = 20;

    /** External services suggested at each escalation level. */
    private Map<EscalationLevel, List<String>> services = new EnumMap<>(Map.of(
            EscalationLevel.SWITCH_CATEGORY, new ArrayList<>(List.of("mcp.so")),
            EscalationLevel.CONSTRUCT_TOOL, new ArrayList<>(List.of("aci.dev", "mcp.so", "github.com")),
            EscalationLevel.MANUAL_INTERVENTION, new ArrayList<>(List.of("zapier.com", "manual-review"))));

    public double getAcceptableScore() { return acceptableScore; }
    public void setAcceptableScore(double acceptableScore) { this.acceptableScore = acceptableScore; }
    public int getHistoryWindow() { return historyWindow; }
    public void setHistoryWindow(int historyWindow) { this.historyWindow = historyWindow; }
    public Map<EscalationLevel, List<String>> getServices() { return services; }
    public void setServices(Map<EscalationLevel, List<String>> services) { this.services = services; }

    public List<String> servicesFor(EscalationLevel level) {
        List<String> configured = services.get(level);
        return configured == null ? List.of() : List.copyOf(configured);
    }
}
