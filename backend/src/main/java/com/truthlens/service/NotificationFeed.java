package com.truthlens.service;

import com.truthlens.entity.Notification;

/**
 * Real-time delivery of new notifications to connected clients.
 *
 * Publishing happens after the surrounding transaction commits; a notification
 * whose transaction rolls back is never published.
 */
public interface NotificationFeed {

    void publish(Notification notification);
}
