package com.routewise.core.learning;

import com.routewise.core.model.ResultStatus;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Smoothing and reward-shaping constants for the learning store.
 */
@Component
@ConfigurationProperties(prefix = "routewise.learning")
public class LearningProperties {

    /** Weight of the newest observation in the moving averages, in (0,1]. */
    private double smoothingFactor = 0.3;

    /** Rebuild weights from persisted records when the application starts. */
    private boolean replayOnStartup = true;

    private Reward reward = new Reward();

    public double getSmoothingFactor() { return smoothingFactor; }
    public void setSmoothingFactor(double smoothingFactor) { this.smoothingFactor = smoothingFactor; }
    public boolean isReplayOnStartup() { return replayOnStartup; }
    public void setReplayOnStartup(boolean replayOnStartup) { this.replayOnStartup = replayOnStartup; }
    public Reward getReward() { return reward; }
    public void setReward(Reward reward) { this.reward = reward; }

    public static class Reward {
        private Map<ResultStatus, Double> base = new EnumMap<>(Map.of(
                ResultStatus.SUCCESS_PERFECT, 1.0,
                ResultStatus.SUCCESS_PARTIAL, 0.6,
                ResultStatus.SUCCESS_ACCEPTABLE, 0.3,
                ResultStatus.FAILURE_USER, -0.2,
                ResultStatus.FAILURE_SYSTEM, -0.5,
                ResultStatus.FAILURE_CONFIG, -0.3,
                ResultStatus.FAILURE_RESOURCE, -0.4));
        private double scoreWeight = 0.5;
        /** Bonus for an instant result, decaying exponentially with execution time. */
        private double efficiencyBonus = 0.2;
        private double efficiencyDecaySeconds = 10.0;
        private double satisfactionWeight = 0.2;

        public Map<ResultStatus, Double> getBase() { return base; }
        public void setBase(Map<ResultStatus, Double> base) { this.base = base; }
        public double getScoreWeight() { return scoreWeight; }
        public void setScoreWeight(double scoreWeight) { this.scoreWeight = scoreWeight; }
        public double getEfficiencyBonus() { return efficiencyBonus; }
        public void setEfficiencyBonus(double efficiencyBonus) { this.efficiencyBonus = efficiencyBonus; }
        public double getEfficiencyDecaySeconds() { return efficiencyDecaySeconds; }
        public void setEfficiencyDecaySeconds(double efficiencyDecaySeconds) { this.efficiencyDecaySeconds = efficiencyDecaySeconds; }
        public double getSatisfactionWeight() { return satisfactionWeight; }
        public void setSatisfactionWeight(double satisfactionWeight) { this.satisfactionWeight = satisfactionWeight; }
    }
}
