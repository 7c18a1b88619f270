package org.learningjava.hpes.domain.model;

import org.learningjava.hpes.domain.model.parse.ParseReport;

import java.util.List;

/**
 * Validated region before scoring.
 *
 * @param parseReport clean report of the accepting grammar for AST outcomes, otherwise null
 * @param ruleScore   fallback ruleset score of the chosen language, 0 for AST outcomes and unknown regions
 */
public record RegionOutcome(
        CandidateRegion region,
        String language,
        BlockType blockType,
        ValidationMethod validationMethod,
        ParseReport parseReport,
        StructuralMetrics metrics,
        double ruleScore,
        List<ExtractionWarning> warnings
) {

    public RegionOutcome {
        warnings = List.copyOf(warnings);
    }

    public TextSpan span() {
        return region.span();
    }

    public boolean isUnknownLanguage() {
        return ExtractedBlock.UNKNOWN_LANGUAGE.equals(language);
    }

    public int nodeCount() {
        return parseReport == null ? 0 : parseReport.nodeCount();
    }
}
