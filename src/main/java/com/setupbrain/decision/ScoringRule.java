package com.setupbrain.decision;

import com.setupbrain.domain.vo.SetupCandidate;

/**
 * One all-or-nothing scoring bucket: either awards its full points or none.
 */
public interface ScoringRule {

    /** Short bucket name used in justifications and the decision log. */
    String getName();

    int getPoints();

    boolean fires(SetupCandidate candidate);
}
