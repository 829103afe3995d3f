package com.setupbrain.decision;

import com.setupbrain.domain.vo.SetupCandidate;

/** Setups that describe a clear structure: a level under test or a squeeze releasing. */
public class StructureClarityScore implements ScoringRule {

    private final int points;

    public StructureClarityScore(int points) {
        this.points = points;
    }

    @Override
    public String getName() {
        return "structure_clarity";
    }

    @Override
    public int getPoints() {
        return points;
    }

    @Override
    public boolean fires(SetupCandidate candidate) {
        return candidate.getSetupType().isStructural();
    }
}
