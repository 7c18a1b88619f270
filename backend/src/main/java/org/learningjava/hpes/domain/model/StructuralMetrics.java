package org.learningjava.hpes.domain.model;

/**
 * Cheap structural signals of a text region.
 *
 * @param technicalDensity share of technical characters blended with keyword share
 * @param keywordDensity   share of words that are common programming keywords
 * @param terminatorRatio  share of non-blank lines ending in a statement terminator or block delimiter
 * @param balancedBrackets whether round, square and curly brackets nest correctly
 * @param proseRatio       share of words that are common English function words
 * @param sentenceCount    number of sentence boundaries ({@code ". X"})
 * @param complexity       count of definitions, control-flow keywords and bracket pairs
 */
public record StructuralMetrics(
        int nonBlankLines,
        double technicalDensity,
        double keywordDensity,
        double terminatorRatio,
        boolean balancedBrackets,
        double proseRatio,
        int sentenceCount,
        int complexity
) {
}
