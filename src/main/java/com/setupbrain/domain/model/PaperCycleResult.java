package com.setupbrain.domain.model;

import com.setupbrain.domain.enums.PaperCycleAction;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one paper trading cycle. {@code opened} is set only for OPENED and
 * {@code closed} only for CLOSED.
 */
@Value
@Builder
public class PaperCycleResult {

    PaperTradingState state;
    PaperCycleAction action;
    OpenPosition opened;
    ClosedTrade closed;

    /** Forming decisions the sizer refused, with the reason, in the order they were tried. */
    @Builder.Default
    List<String> sizingRejections = List.of();
}
