package org.learningjava.hpes.application.usecase;

import org.learningjava.hpes.config.ExtractionProperties;
import org.learningjava.hpes.domain.model.AstVerdict;
import org.learningjava.hpes.domain.model.CandidateRegion;
import org.learningjava.hpes.domain.model.ExtractionRequest;
import org.learningjava.hpes.domain.model.ExtractionResult;
import org.learningjava.hpes.domain.model.NormalizationResult;
import org.learningjava.hpes.domain.model.RegionOutcome;
import org.learningjava.hpes.domain.model.ScoredRegion;
import org.learningjava.hpes.domain.model.SegmentationMode;
import org.learningjava.hpes.domain.model.SourceDocument;
import org.learningjava.hpes.domain.model.language.LanguageProfile;
import org.learningjava.hpes.domain.service.assemble.BlockAssembler;
import org.learningjava.hpes.domain.service.fallback.FallbackExtractor;
import org.learningjava.hpes.domain.service.language.LanguageProfileRegistry;
import org.learningjava.hpes.domain.service.normalize.DocumentNormalizer;
import org.learningjava.hpes.domain.service.score.ConfidenceScorer;
import org.learningjava.hpes.domain.service.segment.Segmenter;
import org.learningjava.hpes.domain.service.segment.TextMetrics;
import org.learningjava.hpes.domain.service.validate.AstValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Single-document extraction: normalize, segment, validate each region against a
 * grammar or fall back to rule sets, score, assemble.
 */
@Service
public class ExtractBlocksUseCase {

    private static final Logger log = LoggerFactory.getLogger(ExtractBlocksUseCase.class);

    private final DocumentNormalizer normalizer;
    private final LanguageProfileRegistry registry;
    private final Segmenter segmenter;
    private final AstValidator validator;
    private final FallbackExtractor fallback;
    private final ConfidenceScorer scorer;
    private final BlockAssembler assembler;
    private final Set<String> documentExtensions;

    public ExtractBlocksUseCase(
            DocumentNormalizer normalizer,
            LanguageProfileRegistry registry,
            Segmenter segmenter,
            AstValidator validator,
            FallbackExtractor fallback,
            ConfidenceScorer scorer,
            BlockAssembler assembler,
            ExtractionProperties props
    ) {
        this.normalizer = normalizer;
        this.registry = registry;
        this.segmenter = segmenter;
        this.validator = validator;
        this.fallback = fallback;
        this.scorer = scorer;
        this.assembler = assembler;
        this.documentExtensions = props.getDocumentExtensions().stream()
                .map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * @throws org.learningjava.hpes.domain.model.InputDecodeException when the input cannot be decoded at all
     */
    public ExtractionResult extract(ExtractionRequest request) {
        NormalizationResult normalized = normalizer.normalize(request);
        SourceDocument doc = normalized.document();
        log.debug("{} INGESTED: {} chars, {} lines", doc.sourceFileId(), doc.length(), doc.lineCount());

        String declared = blankToNull(request.declaredLanguage());
        SegmentationMode mode = selectMode(request.fileName(), declared);
        if (mode == SegmentationMode.WHOLE_FILE && declared == null) {
            declared = registry.forFileName(request.fileName()).map(LanguageProfile::id).orElse(null);
        }

        List<CandidateRegion> regions = segmenter.segment(doc, mode, declared);
        log.debug("{} SEGMENTED: {} mode, {} regions", doc.sourceFileId(), mode, regions.size());

        List<AstVerdict> verdicts = regions.isEmpty() ? List.of() : validator.validate(doc, regions);
        List<RegionOutcome> outcomes = new ArrayList<>(verdicts.size());
        for (AstVerdict verdict : verdicts) {
            outcomes.add(verdict.isAccepted()
                    ? verdict.toAstOutcome(TextMetrics.measure(doc.slice(verdict.span())))
                    : fallback.extract(doc, verdict));
        }
        log.debug("{} VALIDATED: {} by grammar, {} by rules", doc.sourceFileId(),
                verdicts.stream().filter(AstVerdict::isAccepted).count(),
                verdicts.stream().filter(v -> !v.isAccepted()).count());

        List<ScoredRegion> scored = new ArrayList<>(outcomes.size());
        for (RegionOutcome outcome : outcomes) {
            scored.add(scorer.score(outcome, doc, mode));
        }
        log.debug("{} SCORED", doc.sourceFileId());

        ExtractionResult result = assembler.assemble(doc, mode, scored, normalized.warnings());
        log.debug("{} ASSEMBLED", doc.sourceFileId());
        log.info("Extracted {} blocks from {} ({} AST, {} fallback, {} unknown, {} warnings)",
                result.stats().totalExtracted(), doc.sourceFileId(), result.stats().astParsed(),
                result.stats().fallbackExtracted(), result.stats().unknownLanguage(), result.warnings().size());
        return result;
    }

    /**
     * A declared language means the whole file is one program. Otherwise prose
     * formats are scanned for embedded code and everything else is a source file.
     */
    SegmentationMode selectMode(String fileName, String declaredLanguage) {
        if (declaredLanguage != null) {
            return SegmentationMode.WHOLE_FILE;
        }
        return LanguageProfileRegistry.extensionOf(fileName)
                .filter(documentExtensions::contains)
                .map(e -> SegmentationMode.MIXED_CONTENT)
                .orElse(SegmentationMode.WHOLE_FILE);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
