package org.learningjava.hpes.domain.service.fallback;

import org.learningjava.hpes.config.ExtractionProperties;
import org.learningjava.hpes.domain.model.AstVerdict;
import org.learningjava.hpes.domain.model.BlockType;
import org.learningjava.hpes.domain.model.CandidateRegion;
import org.learningjava.hpes.domain.model.ExtractedBlock;
import org.learningjava.hpes.domain.model.RegionOutcome;
import org.learningjava.hpes.domain.model.SourceDocument;
import org.learningjava.hpes.domain.model.StructuralMetrics;
import org.learningjava.hpes.domain.model.ValidationMethod;
import org.learningjava.hpes.domain.model.language.LanguageProfile;
import org.learningjava.hpes.domain.service.language.LanguageProfileRegistry;
import org.learningjava.hpes.domain.service.segment.TextMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Labels regions the grammar path did not accept. Every region leaves here as a
 * block; when no language can be inferred it is labelled {@code unknown}.
 */
@Component
public class FallbackExtractor {

    private static final Logger log = LoggerFactory.getLogger(FallbackExtractor.class);

    private final LanguageProfileRegistry registry;
    private final double minRuleScore;

    public FallbackExtractor(LanguageProfileRegistry registry, ExtractionProperties props) {
        this.registry = registry;
        this.minRuleScore = props.getFallback().getMinRuleScore();
    }

    public RegionOutcome extract(SourceDocument doc, AstVerdict verdict) {
        CandidateRegion region = verdict.region();
        String text = doc.slice(region.span());
        StructuralMetrics metrics = TextMetrics.measure(text);

        Optional<LanguageProfile> labelled = region.declared().flatMap(registry::find)
                .or(() -> region.hint().flatMap(registry::find));
        if (labelled.isPresent()) {
            LanguageProfile p = labelled.get();
            return outcome(verdict, p.id(), ValidationMethod.RULES_DECLARED, metrics, p.ruleScore(text));
        }

        Optional<RuleMatch> best = bestMatch(text);
        if (best.isPresent()) {
            RuleMatch m = best.get();
            log.debug("Region {} labelled {} by rules ({})", region.span(), m.profile().id(), m.score());
            return outcome(verdict, m.profile().id(), ValidationMethod.RULES_DETECTED, metrics, m.score());
        }
        return outcome(verdict, ExtractedBlock.UNKNOWN_LANGUAGE, ValidationMethod.NONE, metrics, 0.0);
    }

    /** Highest ruleset score at or above the threshold; ties keep table order. */
    public Optional<RuleMatch> bestMatch(String text) {
        RuleMatch best = null;
        for (LanguageProfile p : registry.profiles()) {
            double score = p.ruleScore(text);
            if (score >= minRuleScore && (best == null || score > best.score())) {
                best = new RuleMatch(p, score);
            }
        }
        return Optional.ofNullable(best);
    }

    private static RegionOutcome outcome(AstVerdict verdict, String language, ValidationMethod method,
                                         StructuralMetrics metrics, double ruleScore) {
        return new RegionOutcome(verdict.region(), language, BlockType.FALLBACK, method, null, metrics,
                ruleScore, verdict.warnings());
    }

    public record RuleMatch(LanguageProfile profile, double score) {
    }
}
