package com.maildraft.domain.email.model;

public enum ValidationIssueType {
    EMPTY_FIELD(ValidationLayer.LENGTH),
    SUBJECT_LENGTH(ValidationLayer.LENGTH),
    GREETING_LENGTH(ValidationLayer.LENGTH),
    BODY_LENGTH(ValidationLayer.LENGTH),
    CLOSING_LENGTH(ValidationLayer.LENGTH),
    PLACEHOLDER(ValidationLayer.PLACEHOLDER),
    WHITELISTED_PLACEHOLDER(ValidationLayer.PLACEHOLDER),
    UNBALANCED_QUOTES(ValidationLayer.STRUCTURE),
    UNBALANCED_BRACKETS(ValidationLayer.STRUCTURE),
    HOSTILE_LANGUAGE(ValidationLayer.TONE),
    INFORMAL_MARKER(ValidationLayer.TONE),
    EXCESSIVE_UPPERCASE(ValidationLayer.TONE),
    EXCESSIVE_EXCLAMATION(ValidationLayer.TONE),
    GOVERNMENT_ID(ValidationLayer.SENSITIVE),
    PAYMENT_CARD(ValidationLayer.SENSITIVE),
    MULTIPLE_CONTACT_ADDRESSES(ValidationLayer.SENSITIVE),
    BODY_TOO_THIN(ValidationLayer.CONSISTENCY);

    private final ValidationLayer layer;

    ValidationIssueType(ValidationLayer layer) {
        this.layer = layer;
    }

    public ValidationLayer layer() {
        return layer;
    }
}
