package org.learningjava.hpes.domain.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A span proposed by the segmenter, not yet validated.
 *
 * @param declaredLanguage authoritative language (fence tag, file extension); may be null
 * @param languageHint     weak label only used to name a fallback block; may be null
 */
public record CandidateRegion(
        TextSpan span,
        String declaredLanguage,
        String languageHint,
        DetectionMethod detectionMethod
) {

    public CandidateRegion {
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(detectionMethod, "detectionMethod");
    }

    public static CandidateRegion of(TextSpan span, DetectionMethod method) {
        return new CandidateRegion(span, null, null, method);
    }

    public Optional<String> declared() {
        return Optional.ofNullable(declaredLanguage).filter(s -> !s.isBlank());
    }

    public Optional<String> hint() {
        return Optional.ofNullable(languageHint).filter(s -> !s.isBlank());
    }
}
