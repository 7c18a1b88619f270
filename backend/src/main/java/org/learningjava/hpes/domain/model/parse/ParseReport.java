package org.learningjava.hpes.domain.model.parse;

import java.util.List;

/**
 * What a grammar adapter found. A report is clean only when neither the lexer nor
 * the parser reported an error; recovered errors still count.
 */
public record ParseReport(
        String grammarId,
        boolean clean,
        int errorCount,
        int nodeCount,
        List<String> diagnostics
) {

    public ParseReport {
        diagnostics = List.copyOf(diagnostics);
    }

    public static ParseReport clean(String grammarId, int nodeCount) {
        return new ParseReport(grammarId, true, 0, nodeCount, List.of());
    }

    public static ParseReport failed(String grammarId, int errorCount, List<String> diagnostics) {
        return new ParseReport(grammarId, false, Math.max(1, errorCount), 0, diagnostics);
    }

    public static ParseReport failed(String grammarId, String diagnostic) {
        return failed(grammarId, 1, List.of(diagnostic));
    }

    public String firstDiagnostic() {
        return diagnostics.isEmpty() ? "syntax error" : diagnostics.get(0);
    }
}
