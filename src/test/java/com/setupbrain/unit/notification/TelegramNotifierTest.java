package com.setupbrain.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.setupbrain.domain.enums.AlertSeverity;
import com.setupbrain.notification.TelegramConfig;
import com.setupbrain.notification.TelegramNotifier;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * Unit tests for TelegramNotifier: Bot API payload, the rolling one-minute send limit,
 * backlog ordering and best-effort delivery.
 */
class TelegramNotifierTest {

    private static final Instant T0 = Instant.parse("2024-03-01T08:00:00Z");

    private TelegramConfig telegramConfig;
    private RestTemplate restTemplate;
    private Clock clock;
    private TelegramNotifier telegramNotifier;

    @BeforeEach
    void setUp() {
        telegramConfig = new TelegramConfig();
        telegramConfig.setEnabled(true);
        telegramConfig.setBotToken("brain-token");
        telegramConfig.setChatId("-1001");
        telegramConfig.setMaxMessagesPerMinute(2);
        restTemplate = mock(RestTemplate.class);
        clock = mock(Clock.class);
        when(clock.instant()).thenReturn(T0);
        telegramNotifier = new TelegramNotifier(telegramConfig, restTemplate, clock);
    }

    @SuppressWarnings("unchecked")
    private List<String> sentTexts(int expectedPosts) {
        ArgumentCaptor<HttpEntity<Map<String, Object>>> captor = ArgumentCaptor.forClass(HttpEntity.class);
        verify(restTemplate, times(expectedPosts)).postForEntity(anyString(), captor.capture(), eq(String.class));
        return captor.getAllValues().stream()
                .map(entity -> (String) entity.getBody().get("text"))
                .collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("nothing is sent or queued while disabled")
        void disabled() {
            telegramConfig.setEnabled(false);

            telegramNotifier.send("Paper LONG BTCUSDT opened", AlertSeverity.INFO);

            assertThat(telegramNotifier.getBacklogSize()).isZero();
            verify(restTemplate, never()).postForEntity(anyString(), any(), eq(String.class));
        }

        @Test
        @DisplayName("a blank chat id counts as not configured")
        void blankChatId() {
            telegramConfig.setChatId(" ");

            telegramNotifier.send("Brain cycle failed", AlertSeverity.CRITICAL);

            verify(restTemplate, never()).postForEntity(anyString(), any(), eq(String.class));
        }

        @Test
        @SuppressWarnings("unchecked")
        @DisplayName("alert is posted as HTML to the bot's sendMessage endpoint with a severity tag")
        void payload() {
            telegramNotifier.send("<b>Paper LONG BTCUSDT opened</b>", AlertSeverity.INFO);

            ArgumentCaptor<HttpEntity<Map<String, Object>>> captor = ArgumentCaptor.forClass(HttpEntity.class);
            verify(restTemplate)
                    .postForEntity(
                            eq("https://api.telegram.org/botbrain-token/sendMessage"),
                            captor.capture(),
                            eq(String.class));
            assertThat(captor.getValue().getBody())
                    .containsEntry("chat_id", "-1001")
                    .containsEntry("parse_mode", "HTML")
                    .containsEntry("disable_web_page_preview", true)
                    .containsEntry("text", "<b>[INFO]</b> <b>Paper LONG BTCUSDT opened</b>");
        }
    }

    @Nested
    @DisplayName("Send limit")
    class SendLimit {

        @Test
        @DisplayName("alerts over the per-minute limit wait in the backlog")
        void overLimitQueued() {
            telegramNotifier.send("opened", AlertSeverity.INFO);
            telegramNotifier.send("target", AlertSeverity.INFO);
            telegramNotifier.send("stop", AlertSeverity.WARNING);

            assertThat(telegramNotifier.getRemainingThisMinute()).isZero();
            assertThat(telegramNotifier.getBacklogSize()).isOne();
            assertThat(sentTexts(2)).containsExactly("<b>[INFO]</b> opened", "<b>[INFO]</b> target");
        }

        @Test
        @DisplayName("critical alerts go out at once and leave the limit untouched")
        void criticalBypasses() {
            telegramNotifier.send("opened", AlertSeverity.INFO);
            telegramNotifier.send("target", AlertSeverity.INFO);

            telegramNotifier.send("Brain cycle 14 failed", AlertSeverity.CRITICAL);

            assertThat(telegramNotifier.getBacklogSize()).isZero();
            assertThat(sentTexts(3)).last().isEqualTo("<b>[CRITICAL]</b> Brain cycle 14 failed");
        }

        @Test
        @DisplayName("flushing inside the same minute sends nothing")
        void flushWithinMinute() {
            telegramNotifier.send("opened", AlertSeverity.INFO);
            telegramNotifier.send("target", AlertSeverity.INFO);
            telegramNotifier.send("manual close", AlertSeverity.INFO);

            telegramNotifier.flushBacklog();

            assertThat(telegramNotifier.getBacklogSize()).isOne();
        }

        @Test
        @DisplayName("once the minute rolls over the backlog drains stop alerts before info alerts")
        void backlogDrainsBySeverity() {
            telegramNotifier.send("opened", AlertSeverity.INFO);
            telegramNotifier.send("target", AlertSeverity.INFO);
            telegramNotifier.send("manual close", AlertSeverity.INFO);
            telegramNotifier.send("stop hit", AlertSeverity.WARNING);

            when(clock.instant()).thenReturn(T0.plusSeconds(60));
            telegramNotifier.flushBacklog();

            assertThat(telegramNotifier.getBacklogSize()).isZero();
            assertThat(sentTexts(4).subList(2, 4))
                    .containsExactly("<b>[WARNING]</b> stop hit", "<b>[INFO]</b> manual close");
        }

        @Test
        @DisplayName("new alerts queue behind an existing backlog even when a slot frees up")
        void newAlertsKeepBacklogOrder() {
            telegramNotifier.send("first", AlertSeverity.INFO);
            telegramNotifier.send("second", AlertSeverity.INFO);
            telegramNotifier.send("third", AlertSeverity.INFO);

            when(clock.instant()).thenReturn(T0.plusSeconds(61));
            telegramNotifier.send("fourth", AlertSeverity.INFO);

            assertThat(telegramNotifier.getBacklogSize()).isEqualTo(2);
            telegramNotifier.flushBacklog();
            assertThat(sentTexts(4).subList(2, 4)).containsExactly("<b>[INFO]</b> third", "<b>[INFO]</b> fourth");
        }
    }

    @Nested
    @DisplayName("Delivery failures")
    class DeliveryFailures {

        @Test
        @DisplayName("a failed post is counted and not thrown")
        void failureCounted() {
            when(restTemplate.postForEntity(anyString(), any(), eq(String.class)))
                    .thenThrow(new ResourceAccessException("connection refused"));

            telegramNotifier.send("opened", AlertSeverity.INFO);
            telegramNotifier.send("Brain cycle failed", AlertSeverity.CRITICAL);

            assertThat(telegramNotifier.getFailedDeliveries()).isEqualTo(2);
            assertThat(telegramNotifier.getBacklogSize()).isZero();
        }
    }
}
