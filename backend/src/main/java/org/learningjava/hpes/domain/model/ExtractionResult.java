package org.learningjava.hpes.domain.model;

import java.util.List;

/**
 * Output of one extraction run: ordered blocks, the filler spans that together
 * with the blocks partition the document, aggregate counts and recovered warnings.
 */
public record ExtractionResult(
        String sourceFileId,
        SegmentationMode mode,
        List<ExtractedBlock> blocks,
        List<TextSpan> filler,
        ExtractionStats stats,
        List<ExtractionWarning> warnings
) {

    public ExtractionResult {
        blocks = List.copyOf(blocks);
        filler = List.copyOf(filler);
        warnings = List.copyOf(warnings);
    }

    public boolean hasCode() {
        return stats.totalExtracted() > 0;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public List<String> warningMessages() {
        return warnings.stream().map(ExtractionWarning::toString).toList();
    }
}
