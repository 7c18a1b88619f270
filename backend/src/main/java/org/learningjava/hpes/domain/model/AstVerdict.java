package org.learningjava.hpes.domain.model;

import org.learningjava.hpes.domain.model.parse.ParseReport;

import java.util.List;

/**
 * Result of the grammar path for one region. Accepted only with a clean report;
 * everything else continues on the fallback path with the collected warnings.
 */
public record AstVerdict(
        CandidateRegion region,
        String language,
        ValidationMethod validationMethod,
        ParseReport report,
        List<ExtractionWarning> warnings
) {

    public AstVerdict {
        warnings = List.copyOf(warnings);
    }

    public static AstVerdict accepted(CandidateRegion region, String language, ValidationMethod method,
                                      ParseReport report, List<ExtractionWarning> warnings) {
        return new AstVerdict(region, language, method, report, warnings);
    }

    public static AstVerdict rejected(CandidateRegion region, List<ExtractionWarning> warnings) {
        return new AstVerdict(region, null, ValidationMethod.NONE, null, warnings);
    }

    public boolean isAccepted() {
        return report != null && report.clean();
    }

    public TextSpan span() {
        return region.span();
    }

    public RegionOutcome toAstOutcome(StructuralMetrics metrics) {
        if (!isAccepted()) {
            throw new IllegalStateException("Region " + span() + " was not accepted by a grammar");
        }
        return new RegionOutcome(region, language, BlockType.AST, validationMethod, report, metrics, 0.0, warnings);
    }
}
