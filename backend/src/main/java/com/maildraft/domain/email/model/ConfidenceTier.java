package com.maildraft.domain.email.model;

public enum ConfidenceTier {
    HIGH,
    LOW
}
