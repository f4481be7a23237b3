package com.geobot.paper.notify;

/**
 * Best-effort delivery of run summaries. Implementations must not throw.
 */
public interface NotificationSink {

  void send(String text);
}
