package org.learningjava.hpes.domain.model;

/** How a block's language label was established. */
public enum ValidationMethod {
    GRAMMAR_DECLARED,
    GRAMMAR_GUESSED,
    RULES_DECLARED,
    RULES_DETECTED,
    NONE
}
