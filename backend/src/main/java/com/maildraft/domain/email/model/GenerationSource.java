package com.maildraft.domain.email.model;

public enum GenerationSource {
    GENERATED,
    FALLBACK
}
