package com.maildraft.domain.email.model;

public enum LengthTarget {
    SHORT,
    MEDIUM,
    LONG
}
