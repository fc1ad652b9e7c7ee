package com.copytrading.engine.notification;

/** Outbound alert channel (chat bot, e-mail, pager). Implementations may throw on delivery. */
@FunctionalInterface
public interface NotificationSink {
  void deliver(NotificationEvent event);
}
