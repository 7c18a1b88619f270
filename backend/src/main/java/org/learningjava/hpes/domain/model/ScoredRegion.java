package org.learningjava.hpes.domain.model;

public record ScoredRegion(RegionOutcome outcome, double confidence) {

    public TextSpan span() {
        return outcome.span();
    }
}
