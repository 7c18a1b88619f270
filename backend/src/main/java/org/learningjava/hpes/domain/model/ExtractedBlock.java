package org.learningjava.hpes.domain.model;

import java.util.Objects;

/**
 * One extracted code block. Content and boundaries never change after assembly;
 * review feedback only produces copies with a different {@link BlockStatus}.
 */
public record ExtractedBlock(
        String blockId,
        String sourceFileId,
        String language,
        BlockType blockType,
        String content,
        int startLine,
        int endLine,
        int startOffset,
        int endOffset,
        double confidenceScore,
        BlockStatus status,
        DetectionMethod detectionMethod,
        ValidationMethod validationMethod
) {

    public static final String UNKNOWN_LANGUAGE = "unknown";

    public ExtractedBlock {
        Objects.requireNonNull(blockId, "blockId");
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(blockType, "blockType");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(status, "status");
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid line range " + startLine + ".." + endLine);
        }
        if (confidenceScore < 0.0 || confidenceScore > 1.0) {
            throw new IllegalArgumentException("Confidence out of range: " + confidenceScore);
        }
    }

    public TextSpan span() {
        return new TextSpan(startOffset, endOffset);
    }

    public boolean isUnknownLanguage() {
        return UNKNOWN_LANGUAGE.equals(language);
    }

    public ExtractedBlock withStatus(BlockStatus newStatus) {
        return new ExtractedBlock(blockId, sourceFileId, language, blockType, content, startLine, endLine,
                startOffset, endOffset, confidenceScore, newStatus, detectionMethod, validationMethod);
    }
}
