package com.maildraft.domain.email.model;

/**
 * Individual validation issue found in an email draft.
 *
 * @param type        the type of validation issue
 * @param severity    ERROR rejects the draft, WARNING is a suppressed finding
 * @param field       draft field the issue was found in (null for cross-field issues)
 * @param message     human-readable description of the issue
 * @param matchedText the specific text that triggered this issue (nullable)
 */
public record ValidationIssue(
        ValidationIssueType type,
        Severity severity,
        String field,
        String message,
        String matchedText
) {
    public enum Severity {
        ERROR,
        WARNING
    }

    public ValidationLayer layer() {
        return type.layer();
    }
}
