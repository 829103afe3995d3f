package com.setupbrain.notification;

import com.setupbrain.domain.enums.AlertSeverity;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.PriorityQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Delivers brain alerts to a Telegram chat.
 *
 * <p>At most {@code max-messages-per-minute} WARNING and INFO alerts go out in any
 * rolling minute. Alerts over that limit wait in a backlog of {@value #BACKLOG_LIMIT},
 * drained most severe first by {@link #flushBacklog()}; when the backlog is full the
 * newest alert is dropped. CRITICAL alerts (cycle and paper trading faults) are sent at
 * once and do not count against the limit.
 *
 * <p>Delivery is best effort: a failed post is logged and counted, never thrown.
 */
@Component
public class TelegramNotifier {

    private static final Logger log = LoggerFactory.getLogger(TelegramNotifier.class);

    static final String SEND_MESSAGE_URL = "https://api.telegram.org/bot%s/sendMessage";
    static final int BACKLOG_LIMIT = 200;
    private static final Duration WINDOW = Duration.ofMinutes(1);

    private final TelegramConfig telegramConfig;
    private final RestTemplate restTemplate;
    private final Clock clock;

    // Guarded by this.
    private final Deque<Instant> recentSends = new ArrayDeque<>();
    private final PriorityQueue<TelegramMessage> backlog = new PriorityQueue<>(TelegramMessage.DELIVERY_ORDER);
    private long nextSequence;
    private long failedDeliveries;

    @Autowired
    public TelegramNotifier(TelegramConfig telegramConfig) {
        this(telegramConfig, new RestTemplate(), Clock.systemUTC());
    }

    public TelegramNotifier(TelegramConfig telegramConfig, RestTemplate restTemplate, Clock clock) {
        this.telegramConfig = telegramConfig;
        this.restTemplate = restTemplate;
        this.clock = clock;
    }

    public void send(String text, AlertSeverity severity) {
        if (!telegramConfig.isConfigured()) {
            log.debug("Telegram not configured, {} alert not sent", severity);
            return;
        }
        if (severity == AlertSeverity.CRITICAL) {
            deliver(text, severity);
            return;
        }

        boolean withinLimit;
        synchronized (this) {
            withinLimit = backlog.isEmpty() && takeSlot();
            if (!withinLimit) {
                enqueue(text, severity);
            }
        }
        if (withinLimit) {
            deliver(text, severity);
        }
    }

    /** Sends backlogged alerts while the rolling minute has room. */
    @Scheduled(fixedDelay = 1000)
    public void flushBacklog() {
        while (true) {
            TelegramMessage next;
            synchronized (this) {
                if (backlog.isEmpty() || !takeSlot()) {
                    return;
                }
                next = backlog.poll();
            }
            deliver(next.getText(), next.getSeverity());
        }
    }

    public synchronized int getBacklogSize() {
        return backlog.size();
    }

    /** Non-critical sends still allowed in the current rolling minute. */
    public synchronized int getRemainingThisMinute() {
        expireOldSends();
        return Math.max(0, limit() - recentSends.size());
    }

    public synchronized long getFailedDeliveries() {
        return failedDeliveries;
    }

    static String render(String text, AlertSeverity severity) {
        return "<b>[" + severity + "]</b> " + text;
    }

    private boolean takeSlot() {
        expireOldSends();
        if (recentSends.size() >= limit()) {
            return false;
        }
        recentSends.addLast(clock.instant());
        return true;
    }

    private void expireOldSends() {
        Instant cutoff = clock.instant().minus(WINDOW);
        while (!recentSends.isEmpty() && !recentSends.peekFirst().isAfter(cutoff)) {
            recentSends.pollFirst();
        }
    }

    private int limit() {
        return Math.max(1, telegramConfig.getMaxMessagesPerMinute());
    }

    private void enqueue(String text, AlertSeverity severity) {
        if (backlog.size() >= BACKLOG_LIMIT) {
            log.warn("Telegram backlog full ({}), dropping {} alert", BACKLOG_LIMIT, severity);
            return;
        }
        backlog.add(TelegramMessage.builder()
                .text(text)
                .severity(severity)
                .sequence(nextSequence++)
                .queuedAt(clock.instant())
                .build());
        log.info("Telegram send limit reached, {} alerts waiting", backlog.size());
    }

    private void deliver(String text, AlertSeverity severity) {
        Map<String, Object> body = Map.of(
                "chat_id", telegramConfig.getChatId(),
                "text", render(text, severity),
                "parse_mode", "HTML",
                "disable_web_page_preview", true);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            restTemplate.postForEntity(
                    String.format(SEND_MESSAGE_URL, telegramConfig.getBotToken()),
                    new HttpEntity<>(body, headers),
                    String.class);
        } catch (RestClientException e) {
            synchronized (this) {
                failedDeliveries++;
            }
            log.error("Telegram {} alert not delivered: {}", severity, e.getMessage());
        }
    }
}
