package org.learningjava.hpes.domain.model;

import java.util.List;

public record NormalizationResult(SourceDocument document, List<ExtractionWarning> warnings) {

    public NormalizationResult {
        warnings = List.copyOf(warnings);
    }
}
