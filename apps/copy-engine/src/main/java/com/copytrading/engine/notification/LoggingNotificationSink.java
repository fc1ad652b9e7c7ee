package com.copytrading.engine.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingNotificationSink implements NotificationSink {
  private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSink.class);

  @Override
  public void deliver(NotificationEvent event) {
    log.info(
        "Notification type={} message=\"{}\" attributes={} occurredAt={}",
        event.type().metricTag(),
        event.message(),
        event.attributes(),
        event.occurredAt());
  }
}
