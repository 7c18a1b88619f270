package org.learningjava.hpes.domain.model;

public enum WarningKind {
    DECODE,
    MALFORMED_CONTAINER,
    PARSE_FAILURE,
    PARSE_TIMEOUT,
    UNSUPPORTED_LANGUAGE,
    COVERAGE
}
