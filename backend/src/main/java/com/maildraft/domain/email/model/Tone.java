package com.maildraft.domain.email.model;

public enum Tone {
    FORMAL,
    NEUTRAL
}
