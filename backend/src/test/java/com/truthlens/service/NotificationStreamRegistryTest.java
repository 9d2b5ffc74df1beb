package com.truthlens.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NotificationStreamRegistry Unit Tests")
class NotificationStreamRegistryTest {

    private NotificationStreamRegistry registry;
    private UUID userId;

    @BeforeEach
    void setUp() {
        registry = new NotificationStreamRegistry();
        userId = UUID.randomUUID();
    }

    @Test
    @DisplayName("register should track every connection of a user")
    void testRegister_MultipleConnections() {
        // Act
        registry.register(userId);
        registry.register(userId);
        registry.register(UUID.randomUUID());

        // Assert
        assertEquals(2, registry.connectionsOf(userId));
        assertEquals(3, registry.activeConnections());
    }

    @Test
    @DisplayName("deliver should write to every connection of the user only")
    void testDeliver_AllConnectionsOfUser() {
        // Arrange
        registry.register(userId);
        registry.register(userId);
        registry.register(UUID.randomUUID());

        // Act
        int delivered = registry.deliver(userId, "notification", "{\"id\":\"1\"}");

        // Assert
        assertEquals(2, delivered);
    }

    @Test
    @DisplayName("deliver to a user without connections should do nothing")
    void testDeliver_NoConnections() {
        // Act
        int delivered = registry.deliver(userId, "notification", "{}");

        // Assert
        assertEquals(0, delivered);
    }

    @Test
    @DisplayName("deliver should drop connections that can no longer be written")
    void testDeliver_DropsCompletedConnection() {
        // Arrange
        SseEmitter closed = registry.register(userId, new SseEmitter(1000L));
        registry.register(userId, new SseEmitter(1000L));
        closed.complete();

        // Act
        int delivered = registry.deliver(userId, "notification", "{}");

        // Assert
        assertEquals(1, delivered);
        assertEquals(1, registry.connectionsOf(userId));
    }
}
