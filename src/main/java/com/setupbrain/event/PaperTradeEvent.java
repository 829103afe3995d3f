package com.setupbrain.event;

import com.setupbrain.domain.model.ClosedTrade;
import com.setupbrain.domain.model.OpenPosition;
import com.setupbrain.domain.model.PaperAccount;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the PaperTradingService after a paper position opens or closes and the
 * ledger has been written.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>NotificationService: sends the chat alert</li>
 *   <li>CustomMetricsService: counts opens and closes by exit reason</li>
 * </ul>
 */
public class PaperTradeEvent extends ApplicationEvent {

    private final PaperTradeEventType eventType;
    private final OpenPosition position;
    private final ClosedTrade closedTrade;
    private final PaperAccount account;

    private PaperTradeEvent(
            Object source,
            PaperTradeEventType eventType,
            OpenPosition position,
            ClosedTrade closedTrade,
            PaperAccount account) {
        super(source);
        this.eventType = eventType;
        this.position = position;
        this.closedTrade = closedTrade;
        this.account = account;
    }

    public static PaperTradeEvent opened(Object source, OpenPosition position, PaperAccount account) {
        return new PaperTradeEvent(source, PaperTradeEventType.OPENED, position, null, account);
    }

    public static PaperTradeEvent closed(Object source, ClosedTrade closedTrade, PaperAccount account) {
        return new PaperTradeEvent(source, PaperTradeEventType.CLOSED, null, closedTrade, account);
    }

    public PaperTradeEventType getEventType() {
        return eventType;
    }

    /** The new position. Null for CLOSED. */
    public OpenPosition getPosition() {
        return position;
    }

    /** The completed trade. Null for OPENED. */
    public ClosedTrade getClosedTrade() {
        return closedTrade;
    }

    /** Account state after the transition. */
    public PaperAccount getAccount() {
        return account;
    }
}
