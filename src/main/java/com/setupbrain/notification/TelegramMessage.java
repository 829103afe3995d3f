package com.setupbrain.notification;

import com.setupbrain.domain.enums.AlertSeverity;
import java.time.Instant;
import java.util.Comparator;
import lombok.Builder;
import lombok.Value;

/**
 * Alert held back by the per-minute send limit.
 */
@Value
@Builder
public class TelegramMessage {

    /** Most severe first, then in the order the alerts were raised. */
    static final Comparator<TelegramMessage> DELIVERY_ORDER =
            Comparator.comparing(TelegramMessage::getSeverity).thenComparingLong(TelegramMessage::getSequence);

    String text;
    AlertSeverity severity;
    long sequence;
    Instant queuedAt;
}
