package com.copytrading.engine.notification;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fire-and-forget front of the {@link NotificationSink}. A failed delivery is logged and counted;
 * it never reaches the caller.
 */
public class NotificationDispatcher {
  private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);
  private static final String DELIVERED_COUNTER = "copytrading.notifications.delivered";
  private static final String FAILED_COUNTER = "copytrading.notifications.failed";

  private final NotificationSink sink;
  private final MeterRegistry meterRegistry;

  public NotificationDispatcher(NotificationSink sink, MeterRegistry meterRegistry) {
    this.sink = Objects.requireNonNull(sink, "sink must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  public void dispatch(NotificationEvent event) {
    if (event == null) {
      return;
    }
    try {
      sink.deliver(event);
      meterRegistry.counter(DELIVERED_COUNTER, "type", event.type().metricTag()).increment();
    } catch (RuntimeException ex) {
      meterRegistry.counter(FAILED_COUNTER, "type", event.type().metricTag()).increment();
      log.warn(
          "Notification delivery failed type={} error={}",
          event.type().metricTag(),
          ex.getMessage(),
          ex);
    }
  }
}
