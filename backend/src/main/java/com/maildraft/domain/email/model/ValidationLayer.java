package com.maildraft.domain.email.model;

/**
 * Validation layers, in the order they are applied.
 */
public enum ValidationLayer {
    LENGTH,
    PLACEHOLDER,
    STRUCTURE,
    TONE,
    SENSITIVE,
    CONSISTENCY
}
