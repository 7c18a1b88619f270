package org.learningjava.hpes.domain.service.assemble;

import org.learningjava.hpes.domain.model.BlockStatus;
import org.learningjava.hpes.domain.model.ExtractedBlock;
import org.learningjava.hpes.domain.model.ExtractionResult;
import org.learningjava.hpes.domain.model.ExtractionStats;
import org.learningjava.hpes.domain.model.ExtractionWarning;
import org.learningjava.hpes.domain.model.RegionOutcome;
import org.learningjava.hpes.domain.model.ScoredRegion;
import org.learningjava.hpes.domain.model.SegmentationMode;
import org.learningjava.hpes.domain.model.SourceDocument;
import org.learningjava.hpes.domain.model.TextSpan;
import org.learningjava.hpes.domain.model.WarningKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;

/**
 * Final step of a run: drops overlapping losers, builds blocks with content
 * derived ids, records every uncovered character as filler and checks that
 * blocks and filler partition the document.
 */
@Component
public class BlockAssembler {

    private static final Logger log = LoggerFactory.getLogger(BlockAssembler.class);

    private static final Comparator<ScoredRegion> PRIORITY = Comparator
            .comparingDouble(ScoredRegion::confidence).reversed()
            .thenComparing(s -> s.span().length(), Comparator.reverseOrder())
            .thenComparing(ScoredRegion::span);

    public ExtractionResult assemble(SourceDocument doc, SegmentationMode mode, List<ScoredRegion> scored,
                                     List<ExtractionWarning> upstreamWarnings) {
        List<ExtractionWarning> warnings = new ArrayList<>(upstreamWarnings);
        List<ScoredRegion> kept = resolveOverlaps(scored, warnings);

        List<ExtractedBlock> blocks = new ArrayList<>(kept.size());
        for (ScoredRegion s : kept) {
            blocks.add(toBlock(doc, s));
            warnings.addAll(s.outcome().warnings());
        }
        List<TextSpan> filler = complement(doc, blocks);
        verifyPartition(doc, blocks, filler);

        ExtractionStats stats = ExtractionStats.of(blocks);
        log.debug("Assembled {}: {} blocks, {} filler spans", doc.sourceFileId(), blocks.size(), filler.size());
        return new ExtractionResult(doc.sourceFileId(), mode, blocks, filler, stats, warnings);
    }

    private static List<ScoredRegion> resolveOverlaps(List<ScoredRegion> scored, List<ExtractionWarning> warnings) {
        List<ScoredRegion> byPriority = new ArrayList<>(scored);
        byPriority.sort(PRIORITY);

        List<ScoredRegion> kept = new ArrayList<>();
        for (ScoredRegion candidate : byPriority) {
            List<ScoredRegion> clashing = kept.stream().filter(k -> k.span().overlaps(candidate.span())).toList();
            if (clashing.isEmpty()) {
                kept.add(candidate);
                continue;
            }
            int uncovered = candidate.span().length();
            for (ScoredRegion k : clashing) {
                uncovered -= overlap(candidate.span(), k.span());
            }
            if (uncovered > 0) {
                warnings.add(ExtractionWarning.of(WarningKind.COVERAGE,
                        "region " + candidate.span() + " dropped in favour of " + clashing.get(0).span()
                                + ", " + uncovered + " chars left as filler"));
            }
        }
        kept.sort(Comparator.comparing(ScoredRegion::span));
        return kept;
    }

    private static int overlap(TextSpan a, TextSpan b) {
        return Math.max(0, Math.min(a.end(), b.end()) - Math.max(a.start(), b.start()));
    }

    private static ExtractedBlock toBlock(SourceDocument doc, ScoredRegion scored) {
        RegionOutcome o = scored.outcome();
        TextSpan span = o.span();
        String content = doc.slice(span);
        return new ExtractedBlock(
                blockId(doc.sourceFileId(), span, content),
                doc.sourceFileId(),
                o.language(),
                o.blockType(),
                content,
                doc.startLine(span),
                doc.endLine(span),
                span.start(),
                span.end(),
                scored.confidence(),
                BlockStatus.PENDING,
                o.region().detectionMethod(),
                o.validationMethod());
    }

    /** First 16 hex chars of SHA-256 over file id, offsets and content. */
    static String blockId(String sourceFileId, TextSpan span, String content) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            sha.update(sourceFileId.getBytes(StandardCharsets.UTF_8));
            sha.update((byte) 0);
            sha.update((span.start() + ":" + span.end()).getBytes(StandardCharsets.UTF_8));
            sha.update((byte) 0);
            sha.update(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(sha.digest()).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static List<TextSpan> complement(SourceDocument doc, List<ExtractedBlock> blocks) {
        List<TextSpan> filler = new ArrayList<>();
        int cursor = 0;
        for (ExtractedBlock b : blocks) {
            if (b.startOffset() > cursor) {
                filler.add(new TextSpan(cursor, b.startOffset()));
            }
            cursor = b.endOffset();
        }
        if (cursor < doc.length()) {
            filler.add(new TextSpan(cursor, doc.length()));
        }
        return filler;
    }

    private static void verifyPartition(SourceDocument doc, List<ExtractedBlock> blocks, List<TextSpan> filler) {
        List<TextSpan> all = new ArrayList<>(filler);
        blocks.forEach(b -> all.add(b.span()));
        all.sort(Comparator.naturalOrder());
        int cursor = 0;
        for (TextSpan s : all) {
            if (s.start() != cursor || s.isEmpty()) {
                throw new IllegalStateException("Blocks and filler do not partition " + doc.sourceFileId()
                        + " at offset " + cursor);
            }
            cursor = s.end();
        }
        if (cursor != doc.length()) {
            throw new IllegalStateException("Blocks and filler do not cover " + doc.sourceFileId());
        }
    }
}
