package org.learningjava.hpes.domain.service.segment;

import org.learningjava.hpes.config.ExtractionProperties;
import org.learningjava.hpes.domain.model.CandidateRegion;
import org.learningjava.hpes.domain.model.DetectionMethod;
import org.learningjava.hpes.domain.model.SegmentationMode;
import org.learningjava.hpes.domain.model.SourceDocument;
import org.learningjava.hpes.domain.model.TextSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a normalized document into candidate regions. In whole-file mode the
 * document is one region; in mixed-content mode fenced blocks come first, the
 * remaining lines are searched for indented runs and dense paragraphs.
 */
@Component
public class Segmenter {

    private static final Logger log = LoggerFactory.getLogger(Segmenter.class);

    private static final Pattern FENCE_OPEN = Pattern.compile("^ {0,3}(`{3,}|~{3,})\\s*([^\\s`]*)[^`]*$");

    private final ExtractionProperties.Segmentation cfg;

    public Segmenter(ExtractionProperties props) {
        this.cfg = props.getSegmentation();
    }

    public List<CandidateRegion> segment(SourceDocument doc, SegmentationMode mode, String declaredLanguage) {
        if (doc.isBlank()) {
            return List.of();
        }
        List<CandidateRegion> regions = mode == SegmentationMode.WHOLE_FILE
                ? wholeFile(doc, declaredLanguage)
                : mixedContent(doc);
        log.debug("Segmented {} in {} mode into {} regions", doc.sourceFileId(), mode, regions.size());
        return regions;
    }

    private List<CandidateRegion> wholeFile(SourceDocument doc, String declaredLanguage) {
        TextSpan span = trimmed(doc, 1, doc.lineCount());
        if (span == null) {
            return List.of();
        }
        return List.of(new CandidateRegion(span, declaredLanguage, null, DetectionMethod.WHOLE_FILE));
    }

    private List<CandidateRegion> mixedContent(SourceDocument doc) {
        boolean[] claimed = new boolean[doc.lineCount() + 1];
        List<CandidateRegion> regions = new ArrayList<>(fences(doc, claimed));

        List<Heuristic> heuristics = new ArrayList<>();
        heuristics.addAll(indentationRuns(doc, claimed));
        heuristics.addAll(denseParagraphs(doc, claimed));
        regions.addAll(resolveOverlaps(heuristics));

        regions.sort(Comparator.comparing(CandidateRegion::span));
        return regions;
    }

    // --- fences

    private List<CandidateRegion> fences(SourceDocument doc, boolean[] claimed) {
        List<CandidateRegion> out = new ArrayList<>();
        int lines = doc.lineCount();
        int line = 1;
        while (line <= lines) {
            Matcher open = FENCE_OPEN.matcher(doc.line(line));
            if (!open.matches()) {
                line++;
                continue;
            }
            String marker = open.group(1);
            String tag = open.group(2).isEmpty() ? null : open.group(2).toLowerCase(Locale.ROOT);
            int close = findClosingFence(doc, line + 1, marker);

            if (close < 0) {
                // runs to the end of the document; the marker stays inside so it cannot parse cleanly
                TextSpan span = trimmed(doc, line, lines);
                markClaimed(claimed, line, lines);
                if (span != null) {
                    out.add(new CandidateRegion(span, null, tag, DetectionMethod.UNTERMINATED_FENCE));
                }
                log.debug("Unterminated fence at line {} (tag {})", line, tag);
                break;
            }

            markClaimed(claimed, line, close);
            TextSpan interior = close - line > 1 ? trimmed(doc, line + 1, close - 1) : null;
            if (interior != null) {
                out.add(new CandidateRegion(interior, tag, null, DetectionMethod.FENCE));
            }
            line = close + 1;
        }
        return out;
    }

    private static int findClosingFence(SourceDocument doc, int from, String marker) {
        char fenceChar = marker.charAt(0);
        for (int line = from; line <= doc.lineCount(); line++) {
            if (isClosingFence(doc.line(line), fenceChar, marker.length())) {
                return line;
            }
        }
        return -1;
    }

    private static boolean isClosingFence(String line, char fenceChar, int minLength) {
        int i = 0;
        while (i < line.length() && i < 3 && line.charAt(i) == ' ') {
            i++;
        }
        int run = 0;
        while (i < line.length() && line.charAt(i) == fenceChar) {
            run++;
            i++;
        }
        return run >= minLength && line.substring(i).isBlank();
    }

    // --- heuristics

    private record Heuristic(CandidateRegion region, int lines, int strategyOrder) {
    }

    private List<Heuristic> indentationRuns(SourceDocument doc, boolean[] claimed) {
        List<Heuristic> out = new ArrayList<>();
        int runStart = -1;
        for (int line = 1; line <= doc.lineCount() + 1; line++) {
            boolean continues = line <= doc.lineCount() && !claimed[line]
                    && (doc.line(line).isBlank() ? runStart > 0 : isIndented(doc.line(line)));
            if (continues) {
                if (runStart < 0) {
                    runStart = line;
                }
                continue;
            }
            if (runStart > 0) {
                candidate(doc, runStart, line - 1, DetectionMethod.INDENTATION, 0).ifPresent(out::add);
                runStart = -1;
            }
        }
        return out;
    }

    private List<Heuristic> denseParagraphs(SourceDocument doc, boolean[] claimed) {
        List<Heuristic> out = new ArrayList<>();
        int start = -1;
        for (int line = 1; line <= doc.lineCount() + 1; line++) {
            boolean inParagraph = line <= doc.lineCount() && !claimed[line] && !doc.line(line).isBlank();
            if (inParagraph) {
                if (start < 0) {
                    start = line;
                }
                continue;
            }
            if (start > 0) {
                candidate(doc, start, line - 1, DetectionMethod.DENSITY, 1).ifPresent(out::add);
                start = -1;
            }
        }
        return out;
    }

    private Optional<Heuristic> candidate(SourceDocument doc, int first, int last,
                                                    DetectionMethod method, int order) {
        TextSpan span = trimmed(doc, first, last);
        if (span == null) {
            return Optional.empty();
        }
        String text = doc.slice(span);
        int nonBlank = TextMetrics.nonBlankLines(text);
        if (nonBlank < cfg.getMinBlockLines()) {
            return Optional.empty();
        }
        double density = TextMetrics.technicalDensity(text);
        int complexity = TextMetrics.complexity(text);
        boolean code = method == DetectionMethod.INDENTATION
                ? density > cfg.getDensityThreshold() || complexity >= cfg.getIndentComplexity()
                : density > cfg.getDensityThreshold()
                        && (complexity >= cfg.getDensityComplexity() || density > cfg.getStrongDensity());
        if (!code || TextMetrics.looksLikeProse(text, cfg.getMaxProseRatio(), cfg.getMaxSentences())) {
            return Optional.empty();
        }
        int lines = doc.endLine(span) - doc.startLine(span) + 1;
        return Optional.of(new Heuristic(CandidateRegion.of(span, method), lines, order));
    }

    /** Longer regions win; an exact tie goes to the strategy that ran first. */
    private static List<CandidateRegion> resolveOverlaps(List<Heuristic> candidates) {
        List<Heuristic> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.comparingInt(Heuristic::lines).reversed()
                .thenComparing(h -> h.region().span().length(), Comparator.reverseOrder())
                .thenComparingInt(Heuristic::strategyOrder)
                .thenComparing(h -> h.region().span()));

        List<CandidateRegion> kept = new ArrayList<>();
        for (Heuristic h : ordered) {
            TextSpan span = h.region().span();
            if (kept.stream().noneMatch(k -> k.span().overlaps(span))) {
                kept.add(h.region());
            }
        }
        return kept;
    }

    // --- helpers

    private static boolean isIndented(String line) {
        if (line.isBlank()) {
            return false;
        }
        if (line.charAt(0) == '\t') {
            return true;
        }
        int spaces = 0;
        while (spaces < line.length() && line.charAt(spaces) == ' ') {
            spaces++;
        }
        return spaces >= 4;
    }

    /** Span of the non-blank lines between {@code first} and {@code last}, or null when all are blank. */
    static TextSpan trimmed(SourceDocument doc, int first, int last) {
        int from = first;
        while (from <= last && doc.line(from).isBlank()) {
            from++;
        }
        int to = last;
        while (to >= from && doc.line(to).isBlank()) {
            to--;
        }
        if (from > to) {
            return null;
        }
        return new TextSpan(doc.lineStart(from), doc.lineEnd(to));
    }

    private static void markClaimed(boolean[] claimed, int from, int to) {
        for (int i = from; i <= to; i++) {
            claimed[i] = true;
        }
    }
}
