package com.setupbrain.notification;

import com.setupbrain.domain.enums.AlertSeverity;
import com.setupbrain.domain.enums.ExitReason;
import com.setupbrain.domain.model.ClosedTrade;
import com.setupbrain.domain.model.OpenPosition;
import com.setupbrain.domain.model.PaperAccount;
import com.setupbrain.event.PaperTradeEvent;
import com.setupbrain.event.PaperTradeEventType;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Turns paper trade transitions and brain faults into chat alerts.
 *
 * <p>Stop exits are WARNING, faults CRITICAL, everything else INFO. A notification
 * failure is logged and never reaches the caller.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final TelegramNotifier telegramNotifier;

    public NotificationService(TelegramNotifier telegramNotifier) {
        this.telegramNotifier = telegramNotifier;
    }

    public void notify(String message, AlertSeverity severity) {
        try {
            telegramNotifier.send(message, severity);
        } catch (RuntimeException e) {
            log.error("Failed to send {} notification: {}", severity, e.getMessage());
        }
    }

    @EventListener
    @Order(15)
    public void onPaperTradeEvent(PaperTradeEvent event) {
        if (event.getEventType() == PaperTradeEventType.OPENED) {
            notify(formatOpened(event.getPosition(), event.getAccount()), AlertSeverity.INFO);
        } else {
            ClosedTrade trade = event.getClosedTrade();
            AlertSeverity severity =
                    trade.getExitReason() == ExitReason.STOP ? AlertSeverity.WARNING : AlertSeverity.INFO;
            notify(formatClosed(trade, event.getAccount()), severity);
        }
    }

    public void notifyFailure(String title, String detail) {
        notify("<b>" + title + "</b>\n" + detail, AlertSeverity.CRITICAL);
    }

    public String formatOpened(OpenPosition position, PaperAccount account) {
        return String.format(
                Locale.ROOT,
                "<b>Paper %s %s opened</b> (%s %s)%nEntry: %s%nStop: %s%nTarget: %s%nSize: %s%nRisk: %s%nEquity: %s",
                position.getDirection(),
                position.getSymbol(),
                position.getTimeframe(),
                position.getSetupType().getStorageKey(),
                position.getEntryPrice().toPlainString(),
                position.getStopLoss().toPlainString(),
                position.getTakeProfit().toPlainString(),
                position.getSize().toPlainString(),
                position.getRiskAmount().toPlainString(),
                account.getEquity().toPlainString());
    }

    public String formatClosed(ClosedTrade trade, PaperAccount account) {
        return String.format(
                Locale.ROOT,
                "<b>Paper %s %s closed: %s</b>%nEntry: %s%nExit: %s%nP&amp;L: %s (%s%%, %sR)%nEquity: %s (win rate %.1f%%)",
                trade.getDirection(),
                trade.getSymbol(),
                trade.getExitReason(),
                trade.getEntryPrice().toPlainString(),
                trade.getExitPrice().toPlainString(),
                trade.getPnl().toPlainString(),
                trade.getPnlPercent().toPlainString(),
                trade.getRMultiple().toPlainString(),
                account.getEquity().toPlainString(),
                account.getWinRate());
    }
}
