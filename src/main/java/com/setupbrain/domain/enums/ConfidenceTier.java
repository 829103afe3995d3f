package com.setupbrain.domain.enums;

/**
 * Confidence tier used both as the detector's hint on a candidate and as the
 * decision engine's tier derived from the numeric score.
 */
public enum ConfidenceTier {
    LOW,
    MEDIUM,
    HIGH
}
