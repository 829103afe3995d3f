package com.setupbrain.domain.model;

import com.setupbrain.domain.enums.PaperCycleAction;
import com.setupbrain.domain.vo.RecordingStats;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** What one brain cycle did, for logging and the cycle summary decision entry. */
@Value
@Builder
public class CycleSummary {

    long cycleNumber;
    Instant startedAt;
    Instant finishedAt;

    int pairsEvaluated;
    int pairsSkipped;
    int candidates;
    int forming;
    int rejected;

    RecordingStats recordingStats;

    /** Null when paper trading is disabled. */
    PaperCycleAction paperAction;

    boolean paperTradingFailed;
}
