package com.routewise.core.learning;

import com.routewise.core.model.ExecutionRecord;
import org.springframework.stereotype.Component;

/**
 * Shapes an execution record into a scalar reward for adaptive policies.
 * <p>
 * reward = base(status) + scoreWeight * score
 *        + efficiencyBonus * exp(-seconds / decaySeconds)
 *        + satisfactionWeight * satisfaction
 * <p>
 * The sum is left unclamped; consumers clamp if they need to.
 */
@Component
public class RewardCalculator {

    private final LearningProperties.Reward reward;

    public RewardCalculator(LearningProperties properties) {
        this.reward = properties.getReward();
    }

    public double reward(ExecutionRecord record) {
        double total = reward.getBase().getOrDefault(record.status(), 0.0);
        total += reward.getScoreWeight() * record.score();
        total += efficiency(record.executionTime().toMillis() / 1000.0);
        if (record.userSatisfaction() != null) {
            double satisfaction = Math.max(0.0, Math.min(1.0, record.userSatisfaction()));
            total += reward.getSatisfactionWeight() * satisfaction;
        }
        return total;
    }

    private double efficiency(double seconds) {
        if (reward.getEfficiencyDecaySeconds() <= 0) {
            return 0.0;
        }
        return reward.getEfficiencyBonus() * Math.exp(-Math.max(0.0, seconds) / reward.getEfficiencyDecaySeconds());
    }
}
