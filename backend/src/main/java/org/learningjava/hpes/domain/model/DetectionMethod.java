package org.learningjava.hpes.domain.model;

/** Segmenter strategy that proposed a region. */
public enum DetectionMethod {
    WHOLE_FILE,
    FENCE,
    UNTERMINATED_FENCE,
    INDENTATION,
    DENSITY
}
