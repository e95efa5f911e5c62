package com.maildraft.domain.email.model;

import java.util.List;
import java.util.Optional;

/**
 * Result of output validation.
 *
 * @param passed true if no ERROR-level issue was found
 * @param issues every issue collected before validation stopped (at most one ERROR)
 */
public record ValidationResult(
        boolean passed,
        List<ValidationIssue> issues
) {
    public static ValidationResult of(List<ValidationIssue> issues) {
        boolean passed = issues.stream().noneMatch(i -> i.severity() == ValidationIssue.Severity.ERROR);
        return new ValidationResult(passed, List.copyOf(issues));
    }

    public Optional<ValidationIssue> rejection() {
        return issues.stream().filter(i -> i.severity() == ValidationIssue.Severity.ERROR).findFirst();
    }

    public List<ValidationIssue> warnings() {
        return issues.stream().filter(i -> i.severity() == ValidationIssue.Severity.WARNING).toList();
    }
}
