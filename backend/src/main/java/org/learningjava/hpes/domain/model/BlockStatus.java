package org.learningjava.hpes.domain.model;

public enum BlockStatus {
    PENDING,
    ACCEPTED,
    REJECTED
}
