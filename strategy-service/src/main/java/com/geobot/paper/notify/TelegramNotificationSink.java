package com.geobot.paper.notify;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Map;

/**
 * Posts run summaries through the Telegram Bot API {@code sendMessage} call, HTML formatted.
 */
@Slf4j
@RequiredArgsConstructor
public class TelegramNotificationSink implements NotificationSink {

  private final @NonNull RestClient telegramRestClient;
  private final @NonNull String botToken;
  private final @NonNull String chatId;

  @Override
  public void send(String text) {
    if (text == null || text.isBlank()) {
      return;
    }
    try {
      telegramRestClient.post()
          .uri("/bot{token}/sendMessage", botToken)
          .contentType(MediaType.APPLICATION_JSON)
          .body(Map.of(
              "chat_id", chatId,
              "text", text,
              "parse_mode", "HTML"
          ))
          .retrieve()
          .toBodilessEntity();
      log.debug("Telegram message sent, {} chars", text.length());
    } catch (RestClientException e) {
      log.warn("Telegram send failed: {}", e.toString());
    }
  }
}
