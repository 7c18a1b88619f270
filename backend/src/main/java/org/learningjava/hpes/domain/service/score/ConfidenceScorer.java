package org.learningjava.hpes.domain.service.score;

import org.learningjava.hpes.config.ExtractionProperties;
import org.learningjava.hpes.domain.model.BlockType;
import org.learningjava.hpes.domain.model.RegionOutcome;
import org.learningjava.hpes.domain.model.ScoredRegion;
import org.learningjava.hpes.domain.model.SegmentationMode;
import org.learningjava.hpes.domain.model.SourceDocument;
import org.learningjava.hpes.domain.model.StructuralMetrics;
import org.springframework.stereotype.Component;

/**
 * {@code confidence = base + structural bonus - size penalty}, rounded to four
 * decimals and clamped into the band of the block type. The AST band starts at
 * or above the fallback ceiling, so an AST block never ranks below a fallback one.
 */
@Component
public class ConfidenceScorer {

    private final ExtractionProperties.Scoring w;

    public ConfidenceScorer(ExtractionProperties props) {
        this.w = props.getScoring();
        if (!(w.getAstFloor() >= w.getFallbackCeiling() && w.getFallbackCeiling() >= w.getUnknownCeiling())) {
            throw new IllegalStateException("Scoring bands must satisfy astFloor >= fallbackCeiling >= unknownCeiling, got "
                    + w.getAstFloor() + ", " + w.getFallbackCeiling() + ", " + w.getUnknownCeiling());
        }
        if (w.getAstFloor() > 1.0 || w.getUnknownCeiling() < 0.0) {
            throw new IllegalStateException("Scoring bands must lie within [0, 1]");
        }
        if (w.getNodeSaturation() <= 0 || w.getShortRegionLines() < 0) {
            throw new IllegalStateException("nodeSaturation must be positive and shortRegionLines non-negative");
        }
    }

    public ScoredRegion score(RegionOutcome outcome, SourceDocument doc, SegmentationMode mode) {
        return new ScoredRegion(outcome, confidence(outcome, doc, mode));
    }

    public double confidence(RegionOutcome outcome, SourceDocument doc, SegmentationMode mode) {
        double penalty = sizePenalty(outcome, doc, mode);
        if (outcome.blockType() == BlockType.AST) {
            double bonus = w.getAstStructuralMax() * Math.min(1.0, (double) outcome.nodeCount() / w.getNodeSaturation());
            return clamp(round(w.getAstBase() + bonus - penalty), w.getAstFloor(), 1.0);
        }
        StructuralMetrics m = outcome.metrics();
        if (outcome.isUnknownLanguage()) {
            double bonus = (w.getUnknownCeiling() - w.getUnknownBase()) * Math.min(1.0, m.technicalDensity() * 2);
            return clamp(round(w.getUnknownBase() + bonus - penalty), 0.0, w.getUnknownCeiling());
        }
        double structure = 0.5 * outcome.ruleScore()
                + 0.2 * Math.min(1.0, m.keywordDensity() * 4)
                + 0.15 * m.terminatorRatio()
                + 0.15 * (m.balancedBrackets() ? 1.0 : 0.0);
        double bonus = w.getFallbackStructuralMax() * structure;
        return clamp(round(w.getFallbackBase() + bonus - penalty), 0.0, w.getFallbackCeiling());
    }

    private double sizePenalty(RegionOutcome outcome, SourceDocument doc, SegmentationMode mode) {
        double penalty = 0.0;
        int lines = doc.endLine(outcome.span()) - doc.startLine(outcome.span()) + 1;
        if (lines < w.getShortRegionLines()) {
            penalty += w.getShortPenaltyMax() * (w.getShortRegionLines() - lines) / w.getShortRegionLines();
        }
        if (mode == SegmentationMode.MIXED_CONTENT && doc.length() > 0
                && outcome.span().length() > w.getLargeFraction() * doc.length()) {
            penalty += w.getLargePenalty();
        }
        return penalty;
    }

    private static double round(double v) {
        return Math.round(v * 10_000.0) / 10_000.0;
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
