package com.setupbrain.detect;

import com.setupbrain.domain.enums.SetupType;
import com.setupbrain.domain.vo.FeatureSet;
import com.setupbrain.domain.vo.SetupCandidate;
import java.time.Instant;
import java.util.Optional;

/**
 * One named threshold rule. Rules are independent: each sees the same features and
 * none knows whether another fired.
 */
public interface SetupRule {

    SetupType getSetupType();

    Optional<SetupCandidate> evaluate(FeatureSet features, Instant detectedAt);
}
