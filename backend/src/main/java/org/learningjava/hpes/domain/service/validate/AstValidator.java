package org.learningjava.hpes.domain.service.validate;

import org.learningjava.hpes.config.ExtractionProperties;
import org.learningjava.hpes.domain.model.AstVerdict;
import org.learningjava.hpes.domain.model.CandidateRegion;
import org.learningjava.hpes.domain.model.ExtractionWarning;
import org.learningjava.hpes.domain.model.SourceDocument;
import org.learningjava.hpes.domain.model.ValidationMethod;
import org.learningjava.hpes.domain.model.WarningKind;
import org.learningjava.hpes.domain.model.language.LanguageDispatch;
import org.learningjava.hpes.domain.service.language.LanguageProfileRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Grammar path. A registered declared language is parsed with its own grammar only;
 * otherwise the best signature matches are tried in rank order and the first clean
 * parse wins. Regions are validated in parallel and returned in input order.
 */
@Component
public class AstValidator {

    private static final Logger log = LoggerFactory.getLogger(AstValidator.class);

    private final LanguageProfileRegistry registry;
    private final GrammarInvoker invoker;
    private final AsyncTaskExecutor regionExecutor;
    private final ExtractionProperties.Validation cfg;

    public AstValidator(LanguageProfileRegistry registry,
                        GrammarInvoker invoker,
                        @Qualifier("regionExecutor") AsyncTaskExecutor regionExecutor,
                        ExtractionProperties props) {
        this.registry = registry;
        this.invoker = invoker;
        this.regionExecutor = regionExecutor;
        this.cfg = props.getValidation();
    }

    public List<AstVerdict> validate(SourceDocument doc, List<CandidateRegion> regions) {
        if (regions.size() == 1) {
            return List.of(validateRegion(doc, regions.get(0)));
        }
        List<Future<AstVerdict>> futures = new ArrayList<>(regions.size());
        for (CandidateRegion region : regions) {
            futures.add(submit(doc, region));
        }

        List<AstVerdict> verdicts = new ArrayList<>(regions.size());
        try {
            for (Future<AstVerdict> f : futures) {
                verdicts.add(f.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new CancellationException("Validation of " + doc.sourceFileId() + " interrupted");
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            throw new IllegalStateException("Region validation failed for " + doc.sourceFileId(), e.getCause());
        }
        return verdicts;
    }

    private Future<AstVerdict> submit(SourceDocument doc, CandidateRegion region) {
        try {
            return regionExecutor.submit(() -> validateRegion(doc, region));
        } catch (TaskRejectedException e) {
            log.debug("Region pool rejected a task, validating {} inline", region.span());
            return CompletableFuture.completedFuture(validateRegion(doc, region));
        }
    }

    AstVerdict validateRegion(SourceDocument doc, CandidateRegion region) {
        String label = doc.sourceFileId() + " lines " + doc.startLine(region.span()) + "-" + doc.endLine(region.span());
        String text = doc.slice(region.span());
        List<ExtractionWarning> warnings = new ArrayList<>();

        if (text.length() > cfg.getMaxRegionChars()) {
            warnings.add(ExtractionWarning.of(WarningKind.PARSE_FAILURE,
                    label + " has " + text.length() + " chars, above the grammar limit of " + cfg.getMaxRegionChars()));
            return AstVerdict.rejected(region, warnings);
        }

        String source = deindent(text);
        Optional<LanguageDispatch> declared = region.declared().flatMap(registry::dispatch);
        if (declared.isPresent()) {
            return validateDeclared(region, declared.get(), source, label, warnings);
        }
        if (region.declared().isPresent()) {
            log.debug("{}: declared language '{}' is not registered, guessing", label, region.declaredLanguage());
        }

        for (LanguageDispatch candidate : registry.rankGrammarCandidates(text, cfg.getTopK())) {
            GrammarInvoker.Attempt attempt = invoker.invoke(candidate.grammar(), source, label);
            if (attempt.isClean()) {
                log.debug("{}: accepted as {} by {}", label, candidate.languageId(), candidate.grammar().grammarId());
                return AstVerdict.accepted(region, candidate.languageId(), ValidationMethod.GRAMMAR_GUESSED,
                        attempt.report(), warnings);
            }
            if (attempt.warning() != null) {
                warnings.add(attempt.warning());
            }
        }
        return AstVerdict.rejected(region, warnings);
    }

    private AstVerdict validateDeclared(CandidateRegion region, LanguageDispatch dispatch, String source,
                                        String label, List<ExtractionWarning> warnings) {
        if (!dispatch.hasGrammar()) {
            log.debug("{}: no grammar for {}, using rules", label, dispatch.languageId());
            warnings.add(ExtractionWarning.of(WarningKind.UNSUPPORTED_LANGUAGE,
                    label + ": no grammar for " + dispatch.languageId()));
            return AstVerdict.rejected(region, warnings);
        }
        GrammarInvoker.Attempt attempt = invoker.invoke(dispatch.grammar(), source, label);
        if (attempt.isClean()) {
            return AstVerdict.accepted(region, dispatch.languageId(), ValidationMethod.GRAMMAR_DECLARED,
                    attempt.report(), warnings);
        }
        warnings.add(attempt.warning() != null ? attempt.warning()
                : ExtractionWarning.of(WarningKind.PARSE_FAILURE,
                label + " is not valid " + dispatch.languageId() + ": " + attempt.report().firstDiagnostic()));
        return AstVerdict.rejected(region, warnings);
    }

    /** Removes the whitespace prefix shared by all non-blank lines. */
    static String deindent(String text) {
        String[] lines = text.split("\n", -1);
        String common = null;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            int i = 0;
            while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
                i++;
            }
            String prefix = line.substring(0, i);
            common = common == null ? prefix : commonPrefix(common, prefix);
            if (common.isEmpty()) {
                return text;
            }
        }
        if (common == null) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            sb.append(line.startsWith(common) ? line.substring(common.length()) : line.strip());
            if (i < lines.length - 1) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    private static String commonPrefix(String a, String b) {
        int n = Math.min(a.length(), b.length());
        int i = 0;
        while (i < n && a.charAt(i) == b.charAt(i)) {
            i++;
        }
        return a.substring(0, i);
    }
}
