package com.copytrading.engine.notification;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

public record NotificationEvent(
    NotificationType type, String message, Map<String, String> attributes, Instant occurredAt) {
  public NotificationEvent {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(message, "message must not be null");
    Objects.requireNonNull(occurredAt, "occurredAt must not be null");
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }
}
