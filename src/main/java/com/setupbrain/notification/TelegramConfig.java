package com.setupbrain.notification;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Telegram Bot API settings, bound from {@code notifications.telegram.*}.
 * Alerts are only sent when enabled and both the bot token and chat id are set.
 */
@Data
@Component
@ConfigurationProperties(prefix = "notifications.telegram")
public class TelegramConfig {

    private boolean enabled = false;
    private String botToken;
    private String chatId;
    private int maxMessagesPerMinute = 60;

    public boolean isConfigured() {
        return enabled && botToken != null && !botToken.isBlank() && chatId != null && !chatId.isBlank();
    }
}
