package com.setupbrain.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.setupbrain.api.controller.PaperTradingController;
import com.setupbrain.domain.enums.ExitReason;
import com.setupbrain.domain.enums.SetupType;
import com.setupbrain.domain.enums.TradeDirection;
import com.setupbrain.domain.model.ClosedTrade;
import com.setupbrain.domain.model.OpenPosition;
import com.setupbrain.domain.model.PaperAccount;
import com.setupbrain.domain.model.PaperTradingState;
import com.setupbrain.exception.GlobalExceptionHandler;
import com.setupbrain.exception.LedgerConflictException;
import com.setupbrain.exception.ResourceNotFoundException;
import com.setupbrain.simulator.PaperTradingService;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the PaperTradingController.
 */
@ExtendWith(MockitoExtension.class)
class PaperTradingControllerTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private MockMvc mockMvc;

    @Mock
    private PaperTradingService paperTradingService;

    private PaperAccount account;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new PaperTradingController(paperTradingService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
        account = PaperAccount.initial(new BigDecimal("100000"), T0);
    }

    private static OpenPosition position() {
        return OpenPosition.builder()
                .id("pos-1")
                .symbol("BTCUSDT")
                .timeframe("4h")
                .setupType(SetupType.RANGE_BREAK_ATTEMPT)
                .direction(TradeDirection.LONG)
                .entryPrice(new BigDecimal("50000"))
                .size(BigDecimal.ONE)
                .stopLoss(new BigDecimal("49000"))
                .takeProfit(new BigDecimal("52000"))
                .riskAmount(new BigDecimal("1000"))
                .openedAt(T0)
                .highWaterMark(new BigDecimal("50000"))
                .lowWaterMark(new BigDecimal("50000"))
                .build();
    }

    private static ClosedTrade closedTrade() {
        return ClosedTrade.builder()
                .positionId("pos-1")
                .symbol("BTCUSDT")
                .direction(TradeDirection.LONG)
                .entryPrice(new BigDecimal("50000"))
                .exitPrice(new BigDecimal("51000"))
                .exitReason(ExitReason.MANUAL)
                .riskAmount(new BigDecimal("1000"))
                .pnl(new BigDecimal("1000"))
                .build();
    }

    @Test
    @DisplayName("GET /api/paper/account returns equity and statistics")
    void getAccount() throws Exception {
        when(paperTradingService.getState()).thenReturn(PaperTradingState.flat(account));

        mockMvc.perform(get("/api/paper/account"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.equity").value(100000))
                .andExpect(jsonPath("$.totalTrades").value(0));
    }

    @Test
    @DisplayName("GET /api/paper/position returns 204 when flat")
    void positionFlat() throws Exception {
        when(paperTradingService.getState()).thenReturn(PaperTradingState.flat(account));

        mockMvc.perform(get("/api/paper/position")).andExpect(status().isNoContent());
    }

    @Test
    @DisplayName("GET /api/paper/position returns the open position")
    void positionOpen() throws Exception {
        when(paperTradingService.getState()).thenReturn(PaperTradingState.flat(account).withPosition(position()));

        mockMvc.perform(get("/api/paper/position"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.symbol").value("BTCUSDT"))
                .andExpect(jsonPath("$.direction").value("LONG"));
    }

    @Test
    @DisplayName("GET /api/paper/trades caps the limit and filters by symbol")
    void tradesBySymbol() throws Exception {
        when(paperTradingService.getClosedTrades("BTCUSDT", 500)).thenReturn(List.of(closedTrade()));

        mockMvc.perform(get("/api/paper/trades").param("symbol", "BTCUSDT").param("limit", "10000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].exitReason").value("MANUAL"));
    }

    @Test
    @DisplayName("POST /api/paper/position/close closes at the given price")
    void closeWithPrice() throws Exception {
        when(paperTradingService.isEnabled()).thenReturn(true);
        when(paperTradingService.closeManually(new BigDecimal("51000"))).thenReturn(closedTrade());

        mockMvc.perform(post("/api/paper/position/close")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"price\": 51000}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.positionId").value("pos-1"));
    }

    @Test
    @DisplayName("POST /api/paper/position/close without a body uses the market price")
    void closeWithoutBody() throws Exception {
        when(paperTradingService.isEnabled()).thenReturn(true);
        when(paperTradingService.closeManually(null)).thenReturn(closedTrade());

        mockMvc.perform(post("/api/paper/position/close")).andExpect(status().isOk());
    }

    @Test
    @DisplayName("POST /api/paper/position/close returns 404 when flat")
    void closeWhenFlat() throws Exception {
        when(paperTradingService.isEnabled()).thenReturn(true);
        when(paperTradingService.closeManually(null))
                .thenThrow(new ResourceNotFoundException("Open paper position", "current"));

        mockMvc.perform(post("/api/paper/position/close"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("POST /api/paper/position/close returns 409 when paper trading is disabled")
    void closeWhenDisabled() throws Exception {
        when(paperTradingService.isEnabled()).thenReturn(false);

        mockMvc.perform(post("/api/paper/position/close")).andExpect(status().isConflict());
        verify(paperTradingService, never()).closeManually(any());
    }

    @Test
    @DisplayName("POST /api/paper/position/close rejects a negative price")
    void closeNegativePrice() throws Exception {
        mockMvc.perform(post("/api/paper/position/close")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"price\": -5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("POST /api/paper/position/close returns 409 when the position was closed by a concurrent write")
    void closeLosesRace() throws Exception {
        when(paperTradingService.isEnabled()).thenReturn(true);
        when(paperTradingService.closeManually(null))
                .thenThrow(new LedgerConflictException(
                        "Position pos-1 was already closed", Map.of("positionId", "pos-1")));

        mockMvc.perform(post("/api/paper/position/close"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("CONFLICT"))
                .andExpect(jsonPath("$.error.details.positionId").value("pos-1"));
    }

    @Test
    @DisplayName("POST /api/paper/position/close with unparseable JSON is a 400")
    void closeMalformedBody() throws Exception {
        mockMvc.perform(post("/api/paper/position/close")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"price\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.success").value(false));
    }
}
