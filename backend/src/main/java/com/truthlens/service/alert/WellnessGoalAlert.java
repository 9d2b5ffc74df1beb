package com.truthlens.service.alert;

import com.truthlens.entity.NotificationType;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A wellness goal was met today (achieved) or not yet (reminder).
 */
public class WellnessGoalAlert extends WellnessAlert {

    private static final Duration REMINDER_EXPIRY = Duration.ofDays(1);

    private final String goal;
    private final boolean achieved;
    private final Double progress;

    /**
     * @param progress optional measured value the goal was judged on
     */
    public WellnessGoalAlert(String goal, boolean achieved, Double progress) {
        this.goal = goal;
        this.achieved = achieved;
        this.progress = progress;
    }

    public String getGoal() {
        return goal;
    }

    public boolean isAchieved() {
        return achieved;
    }

    @Override
    public NotificationType kind() {
        return achieved ? NotificationType.WELLNESS_GOAL_ACHIEVED : NotificationType.WELLNESS_GOAL_REMINDER;
    }

    @Override
    public String checkKey() {
        return kind().name() + "#" + goal;
    }

    @Override
    public String message() {
        String readable = goal.replace('_', ' ');
        if (achieved) {
            return String.format("Congratulations! You have achieved your %s goal.", readable);
        }
        return String.format("Remember to focus on your %s goal while consuming content today.", readable);
    }

    @Override
    public Map<String, Object> payload() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("goalType", goal);
        data.put("isAchieved", achieved);
        data.put("progress", progress);
        return data;
    }

    @Override
    public Optional<Duration> expiresAfter() {
        return achieved ? Optional.empty() : Optional.of(REMINDER_EXPIRY);
    }
}
