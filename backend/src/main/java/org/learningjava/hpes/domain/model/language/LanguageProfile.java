package org.learningjava.hpes.domain.model.language;

import java.util.List;
import java.util.Set;

/**
 * Read-only entry of the language profile table.
 *
 * @param grammarId     id of the grammar adapter validating this language, null for rules-only languages
 * @param fallbackRules own rules followed by the family rules, never empty
 */
public record LanguageProfile(
        String id,
        String displayName,
        String family,
        List<String> aliases,
        Set<String> extensions,
        Set<String> fileNames,
        List<String> shebangs,
        List<WeightedPattern> signatures,
        String grammarId,
        List<WeightedPattern> fallbackRules
) {

    public LanguageProfile {
        aliases = List.copyOf(aliases);
        extensions = Set.copyOf(extensions);
        fileNames = Set.copyOf(fileNames);
        shebangs = List.copyOf(shebangs);
        signatures = List.copyOf(signatures);
        fallbackRules = List.copyOf(fallbackRules);
    }

    public boolean hasGrammar() {
        return grammarId != null;
    }

    /** Sum of the weights of matching content signatures plus one for a matching shebang. */
    public double signatureScore(String text) {
        double score = matchesShebang(text) ? 1.0 : 0.0;
        for (WeightedPattern p : signatures) {
            if (p.matches(text)) {
                score += p.weight();
            }
        }
        return score;
    }

    /** Fallback ruleset score, capped at 1. */
    public double ruleScore(String text) {
        double score = 0.0;
        for (WeightedPattern rule : fallbackRules) {
            if (rule.matches(text)) {
                score += rule.weight();
            }
        }
        return Math.min(1.0, score);
    }

    public boolean matchesShebang(String text) {
        if (shebangs.isEmpty() || !text.startsWith("#!")) {
            return false;
        }
        int eol = text.indexOf('\n');
        String first = eol < 0 ? text : text.substring(0, eol);
        return shebangs.stream().anyMatch(first::contains);
    }
}
