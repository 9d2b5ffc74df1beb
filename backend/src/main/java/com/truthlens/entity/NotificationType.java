package com.truthlens.entity;

/**
 * Kind of wellness notification, with its fixed title, category and default priority.
 */
public enum NotificationType {
    CONTENT_LIMIT_WARNING("Content Consumption Warning", NotificationCategory.CONTENT_ALERT, NotificationPriority.NORMAL),
    CONTENT_LIMIT_EXCEEDED("Daily Content Limit Exceeded", NotificationCategory.CONTENT_ALERT, NotificationPriority.HIGH),
    BREAK_REMINDER("Time for a Break", NotificationCategory.CONTENT_REMINDER, NotificationPriority.NORMAL),
    LOW_QUALITY_CONTENT_ALERT("Content Quality Alert", NotificationCategory.CONTENT_ALERT, NotificationPriority.NORMAL),
    WELLNESS_GOAL_ACHIEVED("Wellness Goal Achieved", NotificationCategory.WELLNESS_GOAL, NotificationPriority.NORMAL),
    WELLNESS_GOAL_REMINDER("Wellness Goal Reminder", NotificationCategory.WELLNESS_GOAL, NotificationPriority.LOW);

    private final String title;
    private final NotificationCategory category;
    private final NotificationPriority defaultPriority;

    NotificationType(String title, NotificationCategory category, NotificationPriority defaultPriority) {
        this.title = title;
        this.category = category;
        this.defaultPriority = defaultPriority;
    }

    public String getTitle() {
        return title;
    }

    public NotificationCategory getCategory() {
        return category;
    }

    public NotificationPriority getDefaultPriority() {
        return defaultPriority;
    }
}
