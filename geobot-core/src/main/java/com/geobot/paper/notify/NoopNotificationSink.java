package com.geobot.paper.notify;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class NoopNotificationSink implements NotificationSink {

  @Override
  public void send(String text) {
    log.debug("notification skipped (no sink configured), {} chars", text == null ? 0 : text.length());
  }
}
