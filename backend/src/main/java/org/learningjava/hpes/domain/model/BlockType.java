package org.learningjava.hpes.domain.model;

public enum BlockType {
    AST,
    FALLBACK
}
