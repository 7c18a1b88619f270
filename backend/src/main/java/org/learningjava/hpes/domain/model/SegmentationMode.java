package org.learningjava.hpes.domain.model;

public enum SegmentationMode {
    /** The whole buffer is one region; used for source files whose path implies a language. */
    WHOLE_FILE,
    /** Prose interleaved with code; fences first, then indentation and density heuristics. */
    MIXED_CONTENT
}
