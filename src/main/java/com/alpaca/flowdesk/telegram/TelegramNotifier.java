package com.alpaca.flowdesk.telegram;

import com.alpaca.flowdesk.config.AppConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Posts notices through the Telegram Bot API. Without a bot token or chat id the text is
 * only logged.
 */
@Component
public class TelegramNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(TelegramNotifier.class);
    private static final String API = "https://api.telegram.org/bot";

    private final RestTemplate http;
    private final String token;
    private final String chatId;

    public TelegramNotifier(AppConfig cfg, RestTemplate http) {
        this.http = http;
        this.token = cfg.telegramToken();
        this.chatId = cfg.telegramChatId();
        if (!isEnabled()) log.warn("TELEGRAM_BOT_TOKEN / TELEGRAM_CHAT_ID not set; notices will only be logged.");
    }

    public boolean isEnabled() {
        return token != null && !token.isBlank() && chatId != null && !chatId.isBlank();
    }

    @Override
    public void send(String text) {
        log.info("📣 {}", text.replace('\n', ' '));
        if (!isEnabled()) return;
        try {
            http.postForEntity(API + token + "/sendMessage", Map.of("chat_id", chatId, "text", text), String.class);
        } catch (Exception e) {
            log.warn("[TELEGRAM] delivery failed: {}", e.toString());
        }
    }
}
