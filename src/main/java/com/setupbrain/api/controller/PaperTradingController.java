package com.setupbrain.api.controller;

import com.setupbrain.api.dto.request.ManualCloseRequest;
import com.setupbrain.domain.model.ClosedTrade;
import com.setupbrain.domain.model.OpenPosition;
import com.setupbrain.domain.model.PaperAccount;
import com.setupbrain.domain.model.PaperTradingState;
import com.setupbrain.exception.ErrorCode;
import com.setupbrain.exception.SimulationException;
import com.setupbrain.simulator.PaperTradingService;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the paper trading ledger.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/paper/account -- equity and trade statistics</li>
 *   <li>GET /api/paper/position -- the open position, 204 when flat</li>
 *   <li>GET /api/paper/trades -- closed trades, newest first</li>
 *   <li>POST /api/paper/position/close -- close the open position by hand</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/paper")
public class PaperTradingController {

    private static final Logger log = LoggerFactory.getLogger(PaperTradingController.class);

    static final int MAX_TRADES = 500;

    private final PaperTradingService paperTradingService;

    public PaperTradingController(PaperTradingService paperTradingService) {
        this.paperTradingService = paperTradingService;
    }

    @GetMapping("/account")
    public ResponseEntity<PaperAccount> getAccount() {
        return ResponseEntity.ok(paperTradingService.getState().getAccount());
    }

    @GetMapping("/position")
    public ResponseEntity<OpenPosition> getPosition() {
        PaperTradingState state = paperTradingService.getState();
        if (!state.hasOpenPosition()) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(state.getPosition());
    }

    @GetMapping("/trades")
    public ResponseEntity<List<ClosedTrade>> getClosedTrades(
            @RequestParam(defaultValue = "50") int limit, @RequestParam(required = false) String symbol) {
        int pageSize = Math.max(1, Math.min(limit, MAX_TRADES));
        List<ClosedTrade> trades = symbol != null && !symbol.isBlank()
                ? paperTradingService.getClosedTrades(symbol, pageSize)
                : paperTradingService.getClosedTrades(pageSize);
        return ResponseEntity.ok(trades);
    }

    @PostMapping("/position/close")
    public ResponseEntity<ClosedTrade> closePosition(
            @Valid @RequestBody(required = false) ManualCloseRequest manualCloseRequest) {
        if (!paperTradingService.isEnabled()) {
            throw new SimulationException(ErrorCode.CONFLICT, "Paper trading is disabled");
        }
        log.info("Manual paper close requested");
        ClosedTrade closedTrade = paperTradingService.closeManually(
                manualCloseRequest != null ? manualCloseRequest.getPrice() : null);
        return ResponseEntity.ok(closedTrade);
    }
}
