package com.copytrading.engine.support;

import com.copytrading.engine.notification.NotificationEvent;
import com.copytrading.engine.notification.NotificationSink;
import com.copytrading.engine.notification.NotificationType;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingNotificationSink implements NotificationSink {
  private final List<NotificationEvent> events = new CopyOnWriteArrayList<>();

  @Override
  public void deliver(NotificationEvent event) {
    events.add(event);
  }

  public List<NotificationEvent> events() {
    return List.copyOf(events);
  }

  public long count(NotificationType type) {
    return events.stream().filter(event -> event.type() == type).count();
  }
}
