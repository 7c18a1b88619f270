package org.learningjava.hpes.domain.model;

import java.util.Collection;

public record ExtractionStats(
        int astParsed,
        int fallbackExtracted,
        int totalExtracted,
        int unknownLanguage
) {

    public static final ExtractionStats EMPTY = new ExtractionStats(0, 0, 0, 0);

    public static ExtractionStats of(Collection<ExtractedBlock> blocks) {
        int ast = 0;
        int unknown = 0;
        for (ExtractedBlock b : blocks) {
            if (b.blockType() == BlockType.AST) ast++;
            if (b.isUnknownLanguage()) unknown++;
        }
        return new ExtractionStats(ast, blocks.size() - ast, blocks.size(), unknown);
    }

    public ExtractionStats plus(ExtractionStats other) {
        return new ExtractionStats(
                astParsed + other.astParsed,
                fallbackExtracted + other.fallbackExtracted,
                totalExtracted + other.totalExtracted,
                unknownLanguage + other.unknownLanguage);
    }
}
