package com.setupbrain.domain.model;

import com.setupbrain.domain.enums.ConfidenceTier;
import com.setupbrain.domain.enums.SetupType;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The persisted view of a forming setup: one live row per (symbol, timeframe, setupType).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SetupRecord {

    private Long id;

    private String symbol;

    /** Candle interval suffix, e.g. "4h". */
    private String timeframe;

    private SetupType setupType;

    /** Always "FORMING" for records written by the recorder. */
    private String status;

    private ConfidenceTier confidence;

    private Instant detectedAt;

    private String context;

    private String marketContext;

    private Instant updatedAt;
}
